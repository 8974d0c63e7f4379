package com.stockneuro.backend.forecasting.benchmark;

import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.forecasting.adapter.HyperparameterSet;
import com.stockneuro.backend.forecasting.metrics.MetricSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * @param aggregate metrics over the concatenated predictions of every successful split
 * @param summary   mean and spread of the per-split metrics
 */
public record WalkForwardReport(
        String ticker,
        Architecture architecture,
        HyperparameterSet hyperparameters,
        WalkForwardPlan plan,
        int totalSplits,
        int failedSplits,
        List<SplitOutcome> splits,
        MetricSnapshot aggregate,
        Map<String, MetricStat> summary,
        Instant generatedAt
) {
}
