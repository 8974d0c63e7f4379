package com.stockneuro.backend.forecasting.data;

public record ScaledSeries(double[] values, ScaleParams params) {

    public ScaledSeries {
        values = values.clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }
}
