package com.stockneuro.backend.forecasting.data;

import java.util.List;

/**
 * Chronologically split, scaled and windowed series. Scale parameters come from the
 * training slice only; {@code validation} is the held-out split used for scoring,
 * promotion and calibration.
 */
public record PreparedDataset(
        int sequenceLength,
        ScaleParams scaleParams,
        List<Window> train,
        List<Window> validation,
        List<Window> test,
        int trainEndIndex
) {

    public PreparedDataset {
        train = List.copyOf(train);
        validation = List.copyOf(validation);
        test = List.copyOf(test);
    }

    public double[] validationTargets() {
        return targets(validation);
    }

    public double[] testTargets() {
        return targets(test);
    }

    public static double[] targets(List<Window> windows) {
        double[] targets = new double[windows.size()];
        for (int i = 0; i < windows.size(); i++) {
            targets[i] = windows.get(i).target();
        }
        return targets;
    }
}
