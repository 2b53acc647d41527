package com.equipment.analytics.model.analytics;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Statistics over the flattened records of one or more datasets.
 *
 * Derived on every request and never persisted. When {@code totalCount} is
 * zero, {@code averages}, {@code ranges} and {@code standardDeviations} are
 * null rather than NaN, and {@code typeDistribution} still lists every
 * category with a count of zero so chart axes stay stable.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record AnalyticsSummary(

        @JsonProperty("total_count")
        long totalCount,

        @JsonProperty("averages")
        ParameterValues averages,

        @JsonProperty("ranges")
        ParameterRanges ranges,

        @JsonProperty("standard_deviations")
        ParameterValues standardDeviations,

        /** Category label to record count, every category present, in category order. */
        @JsonProperty("type_distribution")
        Map<String, Long> typeDistribution,

        /** Labels of the categories with at least one record, in category order. */
        @JsonProperty("equipment_types")
        List<String> equipmentTypes,

        /** Per-category statistics, only for categories with at least one record. */
        @JsonProperty("stats_by_type")
        Map<String, TypeStatistics> statsByType,

        @JsonProperty("chart_data")
        ChartData chartData

) {
}
