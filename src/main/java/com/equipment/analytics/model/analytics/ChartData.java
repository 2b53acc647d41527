package com.equipment.analytics.model.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ChartData(

        @JsonProperty("pie_chart")
        PieChart pieChart,

        @JsonProperty("bar_chart")
        BarChart barChart

) {
}
