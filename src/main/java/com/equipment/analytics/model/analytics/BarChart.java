package com.equipment.analytics.model.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Per-type parameter averages for grouped bar rendering.
 */
public record BarChart(

        @JsonProperty("labels")
        List<String> labels,

        @JsonProperty("datasets")
        List<BarSeries> datasets

) {
}
