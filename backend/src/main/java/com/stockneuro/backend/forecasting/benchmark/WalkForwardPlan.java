package com.stockneuro.backend.forecasting.benchmark;

import java.util.ArrayList;
import java.util.List;

/**
 * Walk-forward schedule over window indices. Rolling keeps the training span fixed and
 * slides it by {@code stepSize}; expanding anchors it at the first window and grows it.
 */
public record WalkForwardPlan(Strategy strategy, int trainSize, int testSize, int stepSize) {

    public WalkForwardPlan {
        if (strategy == null) {
            throw new IllegalArgumentException("Walk-forward strategy is required");
        }
        if (trainSize < 1 || testSize < 1 || stepSize < 1) {
            throw new IllegalArgumentException("Walk-forward sizes must be positive: train " + trainSize
                    + ", test " + testSize + ", step " + stepSize);
        }
    }

    public List<WalkForwardSplit> splits(int windowCount) {
        List<WalkForwardSplit> splits = new ArrayList<>();
        int offset = 0;
        while (trainSize + offset + testSize <= windowCount) {
            int trainStart = strategy == Strategy.ROLLING ? offset : 0;
            int trainEnd = trainSize + offset;
            splits.add(new WalkForwardSplit(splits.size(), trainStart, trainEnd, trainEnd, trainEnd + testSize));
            offset += stepSize;
        }
        return splits;
    }

    public enum Strategy {
        ROLLING,
        EXPANDING
    }
}
