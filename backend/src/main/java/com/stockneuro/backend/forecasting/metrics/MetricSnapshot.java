package com.stockneuro.backend.forecasting.metrics;

/**
 * Error statistics for one evaluated split. A {@code null} value marks a metric that is
 * undefined for the data (for example MASE on a flat series).
 *
 * @param toleranceAccuracy percentage of predictions within {@code tolerance} relative error
 */
public record MetricSnapshot(
        Double rmse,
        Double mae,
        Double mape,
        Double smape,
        Double mase,
        Double r2,
        Double toleranceAccuracy,
        double tolerance,
        int sampleCount
) {

    public static boolean isValid(Double value) {
        return value != null && Double.isFinite(value);
    }
}
