package com.equipment.analytics.model.response;

import com.equipment.analytics.model.EquipmentRecord;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response body for {@code GET /api/datasets/{id}/equipment}.
 */
public record DatasetEquipmentResponse(

        @JsonProperty("dataset_id")
        long datasetId,

        @JsonProperty("dataset_name")
        String datasetName,

        @JsonProperty("count")
        int count,

        @JsonProperty("equipment")
        List<EquipmentRecord> equipment

) {
}
