package com.stockneuro.backend.controller;

import com.stockneuro.backend.dto.BenchmarkRequest;
import com.stockneuro.backend.dto.WalkForwardRequest;
import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.forecasting.adapter.HyperparameterSet;
import com.stockneuro.backend.forecasting.benchmark.BenchmarkHarness;
import com.stockneuro.backend.forecasting.benchmark.BenchmarkReport;
import com.stockneuro.backend.forecasting.benchmark.WalkForwardBacktester;
import com.stockneuro.backend.forecasting.benchmark.WalkForwardPlan;
import com.stockneuro.backend.forecasting.benchmark.WalkForwardReport;
import com.stockneuro.backend.forecasting.brain.AutoLearningBrain;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/benchmarks")
@RequiredArgsConstructor
@Tag(name = "Benchmark")
public class BenchmarkController {

    private final BenchmarkHarness benchmarkHarness;
    private final WalkForwardBacktester walkForwardBacktester;
    private final AutoLearningBrain brain;

    @PostMapping
    @Operation(summary = "Compare architectures under one split and one hyperparameter set")
    public ResponseEntity<BenchmarkReport> compare(@Valid @RequestBody BenchmarkRequest request) {
        Architecture first = request.getArchitectures().get(0);
        HyperparameterSet hyperparameters = request.getHyperparameters() == null ? null
                : request.getHyperparameters().resolve(first, brain.defaults(first));
        return ResponseEntity.ok(benchmarkHarness.compare(request.getArchitectures(), request.getTicker(),
                hyperparameters));
    }

    @PostMapping("/walk-forward")
    @Operation(summary = "Retrain one architecture on rolling or expanding folds and score each fold")
    public ResponseEntity<WalkForwardReport> walkForward(@Valid @RequestBody WalkForwardRequest request) {
        Architecture architecture = request.getArchitecture();
        HyperparameterSet hyperparameters = request.getHyperparameters() == null ? null
                : request.getHyperparameters().resolve(architecture, brain.defaults(architecture));
        WalkForwardPlan plan = request.resolvePlan(walkForwardBacktester.defaultPlan());
        return ResponseEntity.ok(walkForwardBacktester.backtest(request.getTicker(), architecture, hyperparameters,
                plan));
    }
}
