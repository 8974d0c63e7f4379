package com.stockneuro.backend.forecasting.data;

import com.stockneuro.backend.exception.InsufficientDataException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Component
public class SequencePreprocessor {

    public List<Window> window(double[] series, int length) {
        requireWindowable(series, length);
        List<Window> windows = new ArrayList<>(series.length - length);
        for (int i = length; i < series.length; i++) {
            windows.add(new Window(i, Arrays.copyOfRange(series, i - length, i), series[i]));
        }
        return windows;
    }

    public ScaledSeries scale(double[] series) {
        if (series == null || series.length == 0) {
            throw new InsufficientDataException("Cannot scale an empty series");
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : series) {
            if (!Double.isFinite(value)) {
                throw new InsufficientDataException("Series contains non-finite values");
            }
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        ScaleParams params = new ScaleParams(min, max);
        return new ScaledSeries(apply(series, params), params);
    }

    public double[] apply(double[] series, ScaleParams params) {
        double[] scaled = new double[series.length];
        for (int i = 0; i < series.length; i++) {
            scaled[i] = params.scale(series[i]);
        }
        return scaled;
    }

    public double[] unscale(double[] values, ScaleParams params) {
        double[] restored = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            restored[i] = params.unscale(values[i]);
        }
        return restored;
    }

    public PreparedDataset prepare(double[] series, int length, double trainFraction) {
        return prepare(series, length, trainFraction, 1.0 - trainFraction);
    }

    /**
     * Splits windows by target position into train, validation and test (the remainder),
     * scaling everything with parameters fitted on the points preceding the first
     * validation target.
     */
    public PreparedDataset prepare(double[] series, int length, double trainFraction, double validationFraction) {
        requireWindowable(series, length);
        if (trainFraction <= 0.0 || validationFraction <= 0.0 || trainFraction + validationFraction > 1.0 + 1e-9) {
            throw new IllegalArgumentException("Invalid split fractions " + trainFraction + "/" + validationFraction);
        }
        int windowCount = series.length - length;
        int trainCount = (int) Math.floor(windowCount * trainFraction);
        int validationCount = Math.min(windowCount - trainCount, (int) Math.round(windowCount * validationFraction));
        if (trainCount < 1 || validationCount < 1) {
            throw new InsufficientDataException("Series of " + series.length + " points is too short for window length "
                    + length + " and a held-out split");
        }
        int trainEndIndex = length + trainCount;
        ScaleParams params = scale(Arrays.copyOfRange(series, 0, trainEndIndex)).params();
        List<Window> windows = window(apply(series, params), length);
        return new PreparedDataset(
                length,
                params,
                windows.subList(0, trainCount),
                windows.subList(trainCount, trainCount + validationCount),
                windows.subList(trainCount + validationCount, windowCount),
                trainEndIndex
        );
    }

    private void requireWindowable(double[] series, int length) {
        int size = series == null ? 0 : series.length;
        if (length < 2 || length >= size) {
            throw new InsufficientDataException("Window length " + length + " requires 2 <= length < " + size);
        }
    }
}
