package com.equipment.analytics.model.response;

import com.equipment.analytics.model.DatasetListing;
import com.equipment.analytics.model.SkippedRow;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response body for a successful {@code POST /api/datasets/upload}.
 */
public record UploadResponse(

        @JsonProperty("success")
        boolean success,

        @JsonProperty("message")
        String message,

        @JsonProperty("dataset_id")
        long datasetId,

        @JsonProperty("dataset")
        DatasetListing dataset,

        /**
         * Ingestion warnings (decoding, negative values, duplicates, skipped row count).
         */
        @JsonProperty("warnings")
        List<String> warnings,

        /**
         * Rows left out of the dataset with the reason for each.
         */
        @JsonProperty("skipped_rows")
        List<SkippedRow> skippedRows

) {
}
