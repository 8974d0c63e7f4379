package com.stockneuro.backend.forecasting.benchmark;

import com.stockneuro.backend.forecasting.adapter.HyperparameterSet;

import java.time.Instant;
import java.util.List;

public record BenchmarkReport(
        String ticker,
        HyperparameterSet hyperparameters,
        int trainWindows,
        int validationWindows,
        int testWindows,
        int repeats,
        double tolerance,
        double reproducibilityTolerance,
        Instant generatedAt,
        List<ArchitectureBenchmark> rows
) {
}
