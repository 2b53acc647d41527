package com.equipment.analytics.model.response;

import com.equipment.analytics.model.DatasetListing;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response body for {@code GET /api/datasets}.
 */
public record DatasetListResponse(

        @JsonProperty("count")
        int count,

        /**
         * Retained datasets, newest first.
         */
        @JsonProperty("results")
        List<DatasetListing> results

) {
}
