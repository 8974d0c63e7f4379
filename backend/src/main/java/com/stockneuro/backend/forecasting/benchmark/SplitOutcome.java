package com.stockneuro.backend.forecasting.benchmark;

import com.stockneuro.backend.forecasting.metrics.MetricSnapshot;

public record SplitOutcome(WalkForwardSplit split, MetricSnapshot metrics, String error) {

    public boolean succeeded() {
        return error == null;
    }
}
