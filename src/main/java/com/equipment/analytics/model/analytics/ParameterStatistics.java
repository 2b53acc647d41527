package com.equipment.analytics.model.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Mean, range and sample standard deviation of one parameter over a non-empty record set.
 */
public record ParameterStatistics(

        @JsonProperty("avg")
        double avg,

        @JsonProperty("min")
        double min,

        @JsonProperty("max")
        double max,

        /** Sample standard deviation (n - 1 denominator); 0.0 for a single value. */
        @JsonProperty("std")
        double std

) {
}
