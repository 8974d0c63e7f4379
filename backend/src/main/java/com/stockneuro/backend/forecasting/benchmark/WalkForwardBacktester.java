package com.stockneuro.backend.forecasting.benchmark;

import com.stockneuro.backend.config.ForecastingProperties;
import com.stockneuro.backend.exception.BadRequestException;
import com.stockneuro.backend.exception.InsufficientDataException;
import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.forecasting.adapter.CancellationToken;
import com.stockneuro.backend.forecasting.adapter.HyperparameterSet;
import com.stockneuro.backend.forecasting.adapter.ModelAdapter;
import com.stockneuro.backend.forecasting.adapter.ModelAdapterRegistry;
import com.stockneuro.backend.forecasting.adapter.ModelHandle;
import com.stockneuro.backend.forecasting.brain.AutoLearningBrain;
import com.stockneuro.backend.forecasting.data.ScaleParams;
import com.stockneuro.backend.forecasting.data.SequencePreprocessor;
import com.stockneuro.backend.forecasting.data.Window;
import com.stockneuro.backend.forecasting.metrics.MetricSnapshot;
import com.stockneuro.backend.forecasting.metrics.MetricsEngine;
import com.stockneuro.backend.service.marketdata.MarketDataProvider;
import com.stockneuro.backend.service.marketdata.PriceSeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Retrains one architecture on successive chronological folds and scores each fold on the
 * windows that follow it. Every fold is scaled with parameters fitted on its own training
 * span only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalkForwardBacktester {

    private static final Map<String, Function<MetricSnapshot, Double>> SUMMARY = summaryMetrics();

    private final MarketDataProvider marketDataProvider;
    private final SequencePreprocessor preprocessor;
    private final ModelAdapterRegistry adapters;
    private final MetricsEngine metricsEngine;
    private final AutoLearningBrain brain;
    private final ForecastingProperties properties;

    public WalkForwardPlan defaultPlan() {
        ForecastingProperties.WalkForward config = properties.getBenchmark().getWalkForward();
        return new WalkForwardPlan(config.getStrategy(), config.getTrainSize(), config.getTestSize(),
                config.getStepSize());
    }

    public WalkForwardReport backtest(String ticker, Architecture architecture, HyperparameterSet hyperparameters,
                                      WalkForwardPlan plan) {
        if (architecture == null) {
            throw new BadRequestException("An architecture is required");
        }
        if (hyperparameters != null && hyperparameters.architecture() != architecture) {
            throw new BadRequestException("Hyperparameters are for " + hyperparameters.architecture()
                    + " but the backtest targets " + architecture);
        }
        WalkForwardPlan resolvedPlan = plan != null ? plan : defaultPlan();
        HyperparameterSet resolved = hyperparameters != null ? hyperparameters : brain.defaults(architecture);
        ModelAdapter adapter = adapters.get(architecture);
        PriceSeries series = marketDataProvider.fetchPriceHistory(ticker, properties.getTraining().getDefaultPeriod());
        double[] closes = series.closes();
        int length = resolved.sequenceLength();
        int windowCount = Math.max(0, closes.length - length);
        List<WalkForwardSplit> splits = resolvedPlan.splits(windowCount);
        if (splits.isEmpty()) {
            throw new InsufficientDataException(series.ticker() + " has " + windowCount + " windows of length "
                    + length + ", fewer than one " + resolvedPlan.trainSize() + "+" + resolvedPlan.testSize()
                    + " walk-forward split");
        }
        log.info("Walk-forward backtest of {} on {}: {} {} splits over {} windows", architecture, series.ticker(),
                splits.size(), resolvedPlan.strategy(), windowCount);

        double tolerance = properties.getMetrics().getTolerance();
        List<SplitOutcome> outcomes = new ArrayList<>();
        List<double[]> actualParts = new ArrayList<>();
        List<double[]> predictedParts = new ArrayList<>();
        for (WalkForwardSplit split : splits) {
            try {
                double[][] evaluated = evaluate(adapter, resolved, closes, length, split);
                actualParts.add(evaluated[0]);
                predictedParts.add(evaluated[1]);
                outcomes.add(new SplitOutcome(split, metricsEngine.evaluate(evaluated[0], evaluated[1], tolerance),
                        null));
            } catch (RuntimeException ex) {
                log.warn("Walk-forward split {} of {} failed: {}", split.splitNumber(), architecture, ex.getMessage());
                outcomes.add(new SplitOutcome(split, null, ex.getMessage()));
            }
        }

        MetricSnapshot aggregate = metricsEngine.evaluate(concat(actualParts), concat(predictedParts), tolerance);
        Map<String, MetricStat> summary = new LinkedHashMap<>();
        SUMMARY.forEach((name, extractor) -> summary.put(name, MetricStat.of(outcomes.stream()
                .filter(SplitOutcome::succeeded)
                .map(outcome -> extractor.apply(outcome.metrics()))
                .collect(Collectors.toList()))));
        int failed = (int) outcomes.stream().filter(outcome -> !outcome.succeeded()).count();
        return new WalkForwardReport(series.ticker(), architecture, resolved, resolvedPlan, outcomes.size(), failed,
                outcomes, aggregate, summary, Instant.now());
    }

    private double[][] evaluate(ModelAdapter adapter, HyperparameterSet hyperparameters, double[] closes, int length,
                                WalkForwardSplit split) {
        ScaleParams params = preprocessor.scale(
                Arrays.copyOfRange(closes, split.trainStart(), split.trainEnd() + length)).params();
        List<Window> windows = preprocessor.window(preprocessor.apply(closes, params), length);
        List<Window> train = windows.subList(split.trainStart(), split.trainEnd());
        List<Window> test = windows.subList(split.testStart(), split.testEnd());

        ModelHandle handle = adapter.fit(train, hyperparameters, CancellationToken.none());
        double[] predicted = preprocessor.unscale(adapter.predict(handle, test), params);
        double[] actual = new double[test.size()];
        for (int i = 0; i < actual.length; i++) {
            actual[i] = closes[test.get(i).targetIndex()];
        }
        return new double[][]{actual, predicted};
    }

    private static double[] concat(List<double[]> parts) {
        int size = parts.stream().mapToInt(part -> part.length).sum();
        double[] joined = new double[size];
        int offset = 0;
        for (double[] part : parts) {
            System.arraycopy(part, 0, joined, offset, part.length);
            offset += part.length;
        }
        return joined;
    }

    private static Map<String, Function<MetricSnapshot, Double>> summaryMetrics() {
        Map<String, Function<MetricSnapshot, Double>> metrics = new LinkedHashMap<>();
        metrics.put("rmse", MetricSnapshot::rmse);
        metrics.put("mae", MetricSnapshot::mae);
        metrics.put("mase", MetricSnapshot::mase);
        metrics.put("smape", MetricSnapshot::smape);
        metrics.put("toleranceAccuracy", MetricSnapshot::toleranceAccuracy);
        return metrics;
    }
}
