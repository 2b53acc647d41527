package com.equipment.analytics.model.response;

import com.equipment.analytics.model.EquipmentRecord;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Response body for {@code GET /api/datasets/{id}}.
 */
public record DatasetDetailResponse(

        @JsonProperty("id")
        long id,

        @JsonProperty("name")
        String name,

        @JsonProperty("source_filename")
        String sourceFilename,

        @JsonProperty("row_count")
        int rowCount,

        @JsonProperty("uploaded_at")
        Instant uploadedAt,

        /**
         * Warnings recorded when the dataset was ingested.
         */
        @JsonProperty("warnings")
        List<String> warnings,

        @JsonProperty("equipment")
        List<EquipmentRecord> equipment

) {
}
