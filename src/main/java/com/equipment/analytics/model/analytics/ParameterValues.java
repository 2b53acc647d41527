package com.equipment.analytics.model.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One value per numeric parameter, e.g. the averages or the standard deviations
 * of a record set.
 */
public record ParameterValues(

        @JsonProperty("flowrate")
        double flowrate,

        @JsonProperty("pressure")
        double pressure,

        @JsonProperty("temperature")
        double temperature

) {
}
