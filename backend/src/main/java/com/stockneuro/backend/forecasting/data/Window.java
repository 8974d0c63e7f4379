package com.stockneuro.backend.forecasting.data;

/**
 * Fixed-length slice of a series plus its next-step target.
 *
 * @param targetIndex position of {@code target} in the source series
 */
public record Window(int targetIndex, double[] values, double target) {

    public Window {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("Window values must not be empty");
        }
        values = values.clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public int length() {
        return values.length;
    }

    public double valueAt(int index) {
        return values[index];
    }

    public double last() {
        return values[values.length - 1];
    }
}
