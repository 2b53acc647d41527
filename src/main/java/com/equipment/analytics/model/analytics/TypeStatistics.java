package com.equipment.analytics.model.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Statistics restricted to the records of one equipment type.
 */
public record TypeStatistics(

        @JsonProperty("count")
        long count,

        @JsonProperty("flowrate")
        ParameterStatistics flowrate,

        @JsonProperty("pressure")
        ParameterStatistics pressure,

        @JsonProperty("temperature")
        ParameterStatistics temperature

) {
}
