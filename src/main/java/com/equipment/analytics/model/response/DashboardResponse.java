package com.equipment.analytics.model.response;

import com.equipment.analytics.model.analytics.AnalyticsSummary;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response body for {@code GET /api/datasets/dashboard}: analytics over the
 * owner's whole retention set.
 */
public record DashboardResponse(

        @JsonProperty("datasets_count")
        int datasetsCount,

        @JsonProperty("total_equipment")
        long totalEquipment,

        @JsonProperty("summary")
        AnalyticsSummary summary

) {
}
