package com.equipment.analytics.model.response;

import com.equipment.analytics.model.analytics.AnalyticsSummary;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Response body for {@code GET /api/datasets/{id}/analytics}.
 */
public record DatasetAnalyticsResponse(

        @JsonProperty("dataset_id")
        long datasetId,

        @JsonProperty("dataset_name")
        String datasetName,

        @JsonProperty("uploaded_at")
        Instant uploadedAt,

        @JsonProperty("summary")
        AnalyticsSummary summary

) {
}
