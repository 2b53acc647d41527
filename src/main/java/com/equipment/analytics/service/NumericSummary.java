package com.equipment.analytics.service;

import com.equipment.analytics.model.analytics.ParameterStatistics;

import java.util.Arrays;

/**
 * Count, mean, min, max and sample standard deviation of a non-empty set of values.
 *
 * Values are sorted before any summation and summed with Neumaier's
 * compensated algorithm, so the result depends only on the multiset of values
 * and never on the order they were supplied in. The mean is finite for any
 * finite input; the standard deviation is finite as long as the range of the
 * values stays below {@code Double.MAX_VALUE}.
 */
final class NumericSummary {

    private final int count;
    private final double mean;
    private final double min;
    private final double max;
    private final double sampleStd;

    private NumericSummary(int count, double mean, double min, double max, double sampleStd) {
        this.count = count;
        this.mean = mean;
        this.min = min;
        this.max = max;
        this.sampleStd = sampleStd;
    }

    /**
     * @param values at least one finite value; the array is not modified
     */
    static NumericSummary of(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("values must not be empty");
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int n = sorted.length;

        // Sums run on values divided by a power of two near the largest magnitude,
        // which keeps every partial sum far from overflow and loses no precision.
        double scale = scaleFor(Math.max(Math.abs(sorted[0]), Math.abs(sorted[n - 1])));
        double[] scaled = new double[n];
        for (int i = 0; i < n; i++) {
            scaled[i] = sorted[i] / scale;
        }
        double scaledMean = compensatedSum(scaled) / n;

        double std = 0.0;
        if (n > 1) {
            double[] squaredDeviations = new double[n];
            for (int i = 0; i < n; i++) {
                double d = scaled[i] - scaledMean;
                squaredDeviations[i] = d * d;
            }
            std = Math.sqrt(compensatedSum(squaredDeviations) / (n - 1)) * scale;
        }
        return new NumericSummary(n, scaledMean * scale, sorted[0], sorted[n - 1], std);
    }

    private static double scaleFor(double maxAbs) {
        if (maxAbs == 0.0 || !Double.isFinite(maxAbs)) {
            return 1.0;
        }
        return Math.scalb(1.0, Math.max(Math.getExponent(maxAbs), Double.MIN_EXPONENT));
    }

    static double compensatedSum(double[] values) {
        double sum = 0.0;
        double compensation = 0.0;
        for (double value : values) {
            double t = sum + value;
            if (Math.abs(sum) >= Math.abs(value)) {
                compensation += (sum - t) + value;
            } else {
                compensation += (value - t) + sum;
            }
            sum = t;
        }
        return sum + compensation;
    }

    int count() {
        return count;
    }

    double mean() {
        return mean;
    }

    double min() {
        return min;
    }

    double max() {
        return max;
    }

    double sampleStd() {
        return sampleStd;
    }

    ParameterStatistics toStatistics() {
        return new ParameterStatistics(mean, min, max, sampleStd);
    }
}
