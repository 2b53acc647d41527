package com.equipment.analytics.model.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ParameterRanges(

        @JsonProperty("flowrate")
        ValueRange flowrate,

        @JsonProperty("pressure")
        ValueRange pressure,

        @JsonProperty("temperature")
        ValueRange temperature

) {
}
