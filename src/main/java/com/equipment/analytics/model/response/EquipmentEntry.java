package com.equipment.analytics.model.response;

import com.equipment.analytics.model.EquipmentRecord;
import com.equipment.analytics.model.EquipmentType;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One equipment record together with the dataset it belongs to.
 */
public record EquipmentEntry(

        @JsonProperty("dataset_id")
        long datasetId,

        @JsonProperty("name")
        String name,

        @JsonProperty("type")
        EquipmentType type,

        @JsonProperty("flowrate")
        double flowrate,

        @JsonProperty("pressure")
        double pressure,

        @JsonProperty("temperature")
        double temperature

) {

    public static EquipmentEntry of(long datasetId, EquipmentRecord record) {
        return new EquipmentEntry(datasetId, record.name(), record.type(),
                record.flowrate(), record.pressure(), record.temperature());
    }
}
