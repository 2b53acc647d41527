package com.equipment.analytics.model.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inclusive min/max of one parameter.
 */
public record ValueRange(

        @JsonProperty("min")
        double min,

        @JsonProperty("max")
        double max

) {
}
