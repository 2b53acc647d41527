package com.equipment.analytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One validated piece of equipment belonging to exactly one dataset.
 *
 * Instances are produced by the record normalizer and never change afterwards.
 */
public record EquipmentRecord(

        /** Trimmed, non-empty equipment identifier, unique within its dataset. */
        @JsonProperty("name")
        String name,

        /** Normalized category. */
        @JsonProperty("type")
        EquipmentType type,

        @JsonProperty("flowrate")
        double flowrate,

        @JsonProperty("pressure")
        double pressure,

        @JsonProperty("temperature")
        double temperature

) {
}
