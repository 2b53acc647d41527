package com.equipment.analytics.model.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One bar series, aligned with the labels of its {@link BarChart}.
 */
public record BarSeries(

        @JsonProperty("label")
        String label,

        @JsonProperty("data")
        List<Double> data

) {
}
