package com.stockneuro.backend.forecasting.data;

public record ScaleParams(double min, double max) {

    public double range() {
        double range = max - min;
        return range == 0.0 ? 1.0 : range;
    }

    public double scale(double value) {
        return (value - min) / range();
    }

    public double unscale(double value) {
        return value * range() + min;
    }
}
