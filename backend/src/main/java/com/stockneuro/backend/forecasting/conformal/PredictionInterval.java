package com.stockneuro.backend.forecasting.conformal;

/**
 * Lower and upper bounds around a point forecast. Bounds are infinite when the
 * calibration set is too small for the requested quantile level.
 */
public record PredictionInterval(double lower, double upper, double level) {

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }

    public boolean bounded() {
        return Double.isFinite(lower) && Double.isFinite(upper);
    }

    public double width() {
        return upper - lower;
    }
}
