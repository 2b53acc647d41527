package com.equipment.analytics.model.response;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response body for {@code GET /api/equipment}.
 */
public record EquipmentListResponse(

        @JsonProperty("count")
        int count,

        @JsonProperty("results")
        List<EquipmentEntry> results

) {
}
