package com.stockneuro.backend.forecasting.benchmark;

import java.util.List;

/**
 * Mean and sample standard deviation over repeated runs. {@code validRuns} counts the
 * runs where the metric was defined.
 */
public record MetricStat(Double mean, Double spread, int validRuns) {

    public static MetricStat of(List<Double> values) {
        double sum = 0.0;
        int n = 0;
        for (Double value : values) {
            if (value != null && Double.isFinite(value)) {
                sum += value;
                n++;
            }
        }
        if (n == 0) {
            return new MetricStat(null, null, 0);
        }
        double mean = sum / n;
        double squares = 0.0;
        for (Double value : values) {
            if (value != null && Double.isFinite(value)) {
                squares += (value - mean) * (value - mean);
            }
        }
        double spread = n > 1 ? Math.sqrt(squares / (n - 1)) : 0.0;
        return new MetricStat(mean, spread, n);
    }
}
