package com.equipment.analytics.service;

import com.equipment.analytics.model.Dataset;
import com.equipment.analytics.model.EquipmentRecord;
import com.equipment.analytics.model.EquipmentType;
import com.equipment.analytics.model.analytics.AnalyticsSummary;
import com.equipment.analytics.model.analytics.BarChart;
import com.equipment.analytics.model.analytics.BarSeries;
import com.equipment.analytics.model.analytics.ChartData;
import com.equipment.analytics.model.analytics.ParameterRanges;
import com.equipment.analytics.model.analytics.ParameterValues;
import com.equipment.analytics.model.analytics.PieChart;
import com.equipment.analytics.model.analytics.TypeStatistics;
import com.equipment.analytics.model.analytics.ValueRange;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Computes {@link AnalyticsSummary}s over one dataset or over an owner's whole
 * retention set.
 *
 * Aggregation is defined on the flattened union of all input records; dataset
 * boundaries play no role. Every statistic is computed through
 * {@link NumericSummary}, which sorts before summing, so summaries are
 * identical for any ordering of datasets or records.
 *
 * Chart projections:
 * <ul>
 *   <li><b>pie_chart</b> – every category label with its record count (zeros included).</li>
 *   <li><b>bar_chart</b> – categories with at least one record; one series per
 *       parameter holding the per-category mean.</li>
 * </ul>
 */
@Singleton
public class AnalyticsEngine {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsEngine.class);

    static final String AVG_FLOWRATE = "Avg Flowrate";
    static final String AVG_PRESSURE = "Avg Pressure";
    static final String AVG_TEMPERATURE = "Avg Temperature";

    /**
     * Summarizes the records of all given datasets together.
     *
     * @param datasets datasets to aggregate, possibly empty
     * @return the summary; never null
     */
    public AnalyticsSummary summarize(List<Dataset> datasets) {
        List<EquipmentRecord> records = new ArrayList<>();
        for (Dataset dataset : datasets) {
            records.addAll(dataset.getRecords());
        }
        AnalyticsSummary summary = summarizeRecords(records);
        log.debug("Summarized datasets={} records={}", datasets.size(), summary.totalCount());
        return summary;
    }

    /**
     * Summarizes an arbitrary collection of records.
     *
     * @param records records to aggregate, possibly empty
     * @return the summary; averages, ranges and standard deviations are null when empty
     */
    public AnalyticsSummary summarizeRecords(Collection<EquipmentRecord> records) {
        Map<EquipmentType, List<EquipmentRecord>> byType = new EnumMap<>(EquipmentType.class);
        for (EquipmentType type : EquipmentType.values()) {
            byType.put(type, new ArrayList<>());
        }
        for (EquipmentRecord record : records) {
            byType.get(record.type()).add(record);
        }

        Map<String, Long> typeDistribution = new LinkedHashMap<>();
        List<String> presentTypes = new ArrayList<>();
        Map<String, TypeStatistics> statsByType = new LinkedHashMap<>();
        for (Map.Entry<EquipmentType, List<EquipmentRecord>> entry : byType.entrySet()) {
            String label = entry.getKey().getLabel();
            List<EquipmentRecord> typed = entry.getValue();
            typeDistribution.put(label, (long) typed.size());
            if (!typed.isEmpty()) {
                presentTypes.add(label);
                statsByType.put(label, typeStatistics(typed));
            }
        }

        ParameterValues averages = null;
        ParameterRanges ranges = null;
        ParameterValues standardDeviations = null;
        if (!records.isEmpty()) {
            NumericSummary flowrate = summaryOf(records, EquipmentRecord::flowrate);
            NumericSummary pressure = summaryOf(records, EquipmentRecord::pressure);
            NumericSummary temperature = summaryOf(records, EquipmentRecord::temperature);

            averages = new ParameterValues(flowrate.mean(), pressure.mean(), temperature.mean());
            ranges = new ParameterRanges(
                    new ValueRange(flowrate.min(), flowrate.max()),
                    new ValueRange(pressure.min(), pressure.max()),
                    new ValueRange(temperature.min(), temperature.max()));
            standardDeviations = new ParameterValues(
                    flowrate.sampleStd(), pressure.sampleStd(), temperature.sampleStd());
        }

        ChartData chartData = new ChartData(
                pieChart(typeDistribution),
                barChart(presentTypes, statsByType));

        return new AnalyticsSummary(
                records.size(),
                averages,
                ranges,
                standardDeviations,
                typeDistribution,
                presentTypes,
                statsByType,
                chartData);
    }

    // -----------------------------------------------------------------------
    // Chart projections
    // -----------------------------------------------------------------------

    private static PieChart pieChart(Map<String, Long> typeDistribution) {
        return new PieChart(
                new ArrayList<>(typeDistribution.keySet()),
                new ArrayList<>(typeDistribution.values()));
    }

    private static BarChart barChart(List<String> presentTypes, Map<String, TypeStatistics> statsByType) {
        List<Double> flowrate = new ArrayList<>();
        List<Double> pressure = new ArrayList<>();
        List<Double> temperature = new ArrayList<>();
        for (String label : presentTypes) {
            TypeStatistics stats = statsByType.get(label);
            flowrate.add(stats.flowrate().avg());
            pressure.add(stats.pressure().avg());
            temperature.add(stats.temperature().avg());
        }
        return new BarChart(
                List.copyOf(presentTypes),
                List.of(
                        new BarSeries(AVG_FLOWRATE, flowrate),
                        new BarSeries(AVG_PRESSURE, pressure),
                        new BarSeries(AVG_TEMPERATURE, temperature)));
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    private static TypeStatistics typeStatistics(List<EquipmentRecord> records) {
        return new TypeStatistics(
                records.size(),
                summaryOf(records, EquipmentRecord::flowrate).toStatistics(),
                summaryOf(records, EquipmentRecord::pressure).toStatistics(),
                summaryOf(records, EquipmentRecord::temperature).toStatistics());
    }

    private static NumericSummary summaryOf(Collection<EquipmentRecord> records,
                                            ToDoubleFunction<EquipmentRecord> parameter) {
        double[] values = new double[records.size()];
        int i = 0;
        for (EquipmentRecord record : records) {
            values[i++] = parameter.applyAsDouble(record);
        }
        return NumericSummary.of(values);
    }
}
