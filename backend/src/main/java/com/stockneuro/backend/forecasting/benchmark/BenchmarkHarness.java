package com.stockneuro.backend.forecasting.benchmark;

import com.stockneuro.backend.config.ForecastingProperties;
import com.stockneuro.backend.exception.BadRequestException;
import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.forecasting.adapter.CancellationToken;
import com.stockneuro.backend.forecasting.adapter.HyperparameterSet;
import com.stockneuro.backend.forecasting.adapter.ModelAdapter;
import com.stockneuro.backend.forecasting.adapter.ModelAdapterRegistry;
import com.stockneuro.backend.forecasting.adapter.ModelHandle;
import com.stockneuro.backend.forecasting.brain.AutoLearningBrain;
import com.stockneuro.backend.forecasting.conformal.CalibrationSet;
import com.stockneuro.backend.forecasting.conformal.ConformalPredictor;
import com.stockneuro.backend.forecasting.conformal.PredictionInterval;
import com.stockneuro.backend.forecasting.data.PreparedDataset;
import com.stockneuro.backend.forecasting.data.SequencePreprocessor;
import com.stockneuro.backend.forecasting.metrics.MetricSnapshot;
import com.stockneuro.backend.forecasting.metrics.MetricsEngine;
import com.stockneuro.backend.service.marketdata.MarketDataProvider;
import com.stockneuro.backend.service.marketdata.PriceSeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.Pointer;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryPoolMXBean;
import java.lang.management.MemoryType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Fixed evaluation protocol: one chronological train/validation/test split, the same
 * hyperparameters for every architecture, N seeded repeats per architecture. Architectures
 * run one after another so memory readings are attributable. Memory is reported twice: the
 * JVM heap peak, and the native bytes JavaCPP holds for ND4J arrays after inference.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BenchmarkHarness {

    private static final Map<String, Function<MetricSnapshot, Double>> METRICS = orderedMetrics();

    private final MarketDataProvider marketDataProvider;
    private final SequencePreprocessor preprocessor;
    private final ModelAdapterRegistry adapters;
    private final MetricsEngine metricsEngine;
    private final ConformalPredictor conformalPredictor;
    private final AutoLearningBrain brain;
    private final ForecastingProperties properties;

    public BenchmarkReport compare(List<Architecture> architectures, String ticker, HyperparameterSet hyperparameters) {
        if (architectures == null || architectures.isEmpty()) {
            throw new BadRequestException("At least one architecture is required");
        }
        ForecastingProperties.Benchmark config = properties.getBenchmark();
        HyperparameterSet base = hyperparameters != null ? hyperparameters : brain.defaults(architectures.get(0));
        PriceSeries series = marketDataProvider.fetchPriceHistory(ticker, properties.getTraining().getDefaultPeriod());
        PreparedDataset dataset = preprocessor.prepare(series.closes(), base.sequenceLength(),
                config.getTrainFraction(), config.getValidationFraction());
        if (dataset.test().isEmpty()) {
            throw new BadRequestException("Series for " + ticker + " leaves no test windows");
        }
        double tolerance = properties.getMetrics().getTolerance();
        int repeats = Math.max(1, config.getRepeats());
        log.info("Benchmarking {} on {}: {} train / {} validation / {} test windows, {} repeats", architectures,
                series.ticker(), dataset.train().size(), dataset.validation().size(), dataset.test().size(), repeats);

        List<ArchitectureBenchmark> rows = new ArrayList<>();
        for (Architecture architecture : architectures) {
            rows.add(benchmark(adapters.get(architecture), base.toBuilder().architecture(architecture).build(),
                    dataset, repeats, tolerance, config.getReproducibilityTolerance()));
        }
        return new BenchmarkReport(series.ticker(), base, dataset.train().size(), dataset.validation().size(),
                dataset.test().size(), repeats, tolerance, config.getReproducibilityTolerance(), Instant.now(), rows);
    }

    private ArchitectureBenchmark benchmark(ModelAdapter adapter, HyperparameterSet hyperparameters,
                                            PreparedDataset dataset, int repeats, double tolerance,
                                            double reproducibilityTolerance) {
        List<MetricSnapshot> snapshots = new ArrayList<>();
        List<Double> trainingMillis = new ArrayList<>();
        List<Double> latencies = new ArrayList<>();
        List<Double> peaks = new ArrayList<>();
        List<Double> offHeap = new ArrayList<>();
        List<Double> coverages = new ArrayList<>();
        double[] actual = preprocessor.unscale(dataset.testTargets(), dataset.scaleParams());
        double coverageTarget = properties.getConformal().getDefaultCoverage();
        try {
            for (int repeat = 0; repeat < repeats; repeat++) {
                HyperparameterSet seeded = hyperparameters.toBuilder().seed(hyperparameters.seed() + repeat).build();
                resetHeapPeaks();
                long fitStart = System.nanoTime();
                ModelHandle handle = adapter.fit(dataset.train(), seeded, CancellationToken.none());
                trainingMillis.add((System.nanoTime() - fitStart) / 1_000_000.0);

                long predictStart = System.nanoTime();
                double[] predicted = adapter.predict(handle, dataset.test());
                latencies.add((System.nanoTime() - predictStart) / 1_000.0 / dataset.test().size());
                peaks.add((double) heapPeakBytes());
                offHeap.add((double) Pointer.totalBytes());

                snapshots.add(metricsEngine.evaluate(actual,
                        preprocessor.unscale(predicted, dataset.scaleParams()), tolerance));
                coverages.add(intervalCoverage(adapter, handle, dataset, predicted, coverageTarget));
            }
        } catch (RuntimeException ex) {
            log.warn("Benchmark of {} stopped after {} run(s): {}", adapter.architecture(), snapshots.size(),
                    ex.getMessage());
            return summarize(adapter.architecture(), snapshots, trainingMillis, latencies, peaks, offHeap, coverages,
                    reproducibilityTolerance, ex.getMessage());
        }
        return summarize(adapter.architecture(), snapshots, trainingMillis, latencies, peaks, offHeap, coverages,
                reproducibilityTolerance, null);
    }

    private Double intervalCoverage(ModelAdapter adapter, ModelHandle handle, PreparedDataset dataset,
                                    double[] predictedTest, double coverageTarget) {
        if (dataset.validation().size() < properties.getConformal().getMinCalibrationSize()) {
            return null;
        }
        CalibrationSet calibration = conformalPredictor.calibrate(null, adapter, handle, dataset.validation());
        double[] targets = dataset.testTargets();
        int covered = 0;
        for (int i = 0; i < targets.length; i++) {
            PredictionInterval interval = conformalPredictor.interval(predictedTest[i], calibration, coverageTarget);
            if (interval.contains(targets[i])) {
                covered++;
            }
        }
        return (double) covered / targets.length;
    }

    private ArchitectureBenchmark summarize(Architecture architecture, List<MetricSnapshot> snapshots,
                                            List<Double> trainingMillis, List<Double> latencies, List<Double> peaks,
                                            List<Double> offHeap, List<Double> coverages,
                                            double reproducibilityTolerance, String error) {
        Map<String, MetricStat> metrics = new LinkedHashMap<>();
        METRICS.forEach((name, extractor) -> metrics.put(name,
                MetricStat.of(snapshots.stream().map(extractor).collect(Collectors.toList()))));
        MetricStat accuracy = metrics.get("toleranceAccuracy");
        boolean reproducible = error == null && accuracy.spread() != null
                && accuracy.spread() <= reproducibilityTolerance;
        return new ArchitectureBenchmark(architecture, List.copyOf(snapshots), metrics, MetricStat.of(trainingMillis),
                MetricStat.of(latencies), MetricStat.of(peaks), MetricStat.of(offHeap), MetricStat.of(coverages), reproducible,
                error);
    }

    private static void resetHeapPeaks() {
        for (MemoryPoolMXBean pool : ManagementFactory.getMemoryPoolMXBeans()) {
            if (pool.getType() == MemoryType.HEAP) {
                pool.resetPeakUsage();
            }
        }
    }

    private static long heapPeakBytes() {
        long total = 0;
        for (MemoryPoolMXBean pool : ManagementFactory.getMemoryPoolMXBeans()) {
            if (pool.getType() == MemoryType.HEAP && pool.getPeakUsage() != null) {
                total += pool.getPeakUsage().getUsed();
            }
        }
        return total;
    }

    private static Map<String, Function<MetricSnapshot, Double>> orderedMetrics() {
        Map<String, Function<MetricSnapshot, Double>> metrics = new LinkedHashMap<>();
        metrics.put("rmse", MetricSnapshot::rmse);
        metrics.put("mae", MetricSnapshot::mae);
        metrics.put("mape", MetricSnapshot::mape);
        metrics.put("smape", MetricSnapshot::smape);
        metrics.put("mase", MetricSnapshot::mase);
        metrics.put("r2", MetricSnapshot::r2);
        metrics.put("toleranceAccuracy", MetricSnapshot::toleranceAccuracy);
        return metrics;
    }
}
