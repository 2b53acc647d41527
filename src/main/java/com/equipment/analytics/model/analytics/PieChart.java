package com.equipment.analytics.model.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Category distribution for pie/donut rendering; {@code labels} and {@code data} are parallel.
 */
public record PieChart(

        @JsonProperty("labels")
        List<String> labels,

        @JsonProperty("data")
        List<Long> data

) {
}
