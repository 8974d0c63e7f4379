package com.stockneuro.backend.forecasting.adapter;

import lombok.Builder;

@Builder(toBuilder = true)
public record HyperparameterSet(
        Architecture architecture,
        int sequenceLength,
        int hiddenUnits,
        double dropout,
        double learningRate,
        int epochs,
        int batchSize,
        int layers,
        long seed
) {

    public HyperparameterSet {
        if (architecture == null) {
            throw new IllegalArgumentException("architecture is required");
        }
        if (sequenceLength < 2) {
            throw new IllegalArgumentException("sequenceLength must be at least 2");
        }
        if (hiddenUnits < 1 || epochs < 1 || batchSize < 1 || layers < 1) {
            throw new IllegalArgumentException("hiddenUnits, epochs, batchSize and layers must be positive");
        }
        if (dropout < 0.0 || dropout >= 1.0) {
            throw new IllegalArgumentException("dropout must be in [0, 1)");
        }
        if (!(learningRate > 0.0) || Double.isInfinite(learningRate)) {
            throw new IllegalArgumentException("learningRate must be positive");
        }
    }
}
