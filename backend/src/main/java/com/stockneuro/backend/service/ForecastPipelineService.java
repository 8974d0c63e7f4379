package com.stockneuro.backend.service;

import com.stockneuro.backend.config.ForecastingProperties;
import com.stockneuro.backend.exception.ArtifactStorageException;
import com.stockneuro.backend.exception.BadRequestException;
import com.stockneuro.backend.exception.TrainingCancelledException;
import com.stockneuro.backend.exception.TrainingDivergedException;
import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.forecasting.adapter.CancellationToken;
import com.stockneuro.backend.forecasting.adapter.HyperparameterSet;
import com.stockneuro.backend.forecasting.adapter.ModelAdapter;
import com.stockneuro.backend.forecasting.adapter.ModelAdapterRegistry;
import com.stockneuro.backend.forecasting.adapter.ModelHandle;
import com.stockneuro.backend.forecasting.analogue.AnalogueRetriever;
import com.stockneuro.backend.forecasting.brain.AutoLearningBrain;
import com.stockneuro.backend.forecasting.brain.TrainingRunLog;
import com.stockneuro.backend.forecasting.conformal.CalibrationStore;
import com.stockneuro.backend.forecasting.conformal.ConformalPredictor;
import com.stockneuro.backend.forecasting.data.PreparedDataset;
import com.stockneuro.backend.forecasting.data.SequencePreprocessor;
import com.stockneuro.backend.forecasting.metrics.MetricSnapshot;
import com.stockneuro.backend.forecasting.metrics.MetricsEngine;
import com.stockneuro.backend.forecasting.registry.ModelRegistryService;
import com.stockneuro.backend.forecasting.registry.RegistrationResult;
import com.stockneuro.backend.model.TrainingRun;
import com.stockneuro.backend.service.marketdata.MarketDataProvider;
import com.stockneuro.backend.service.marketdata.PriceSeries;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * train_and_evaluate: fetch, prepare, fit, score the held-out split, register and
 * calibrate. Failures end in a sealed run and never touch the serving version.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ForecastPipelineService {

    private final MarketDataProvider marketDataProvider;
    private final SequencePreprocessor preprocessor;
    private final ModelAdapterRegistry adapters;
    private final MetricsEngine metricsEngine;
    private final AutoLearningBrain brain;
    private final TrainingRunLog runLog;
    private final ModelRegistryService registry;
    private final ConformalPredictor conformalPredictor;
    private final CalibrationStore calibrationStore;
    private final AnalogueRetriever analogueRetriever;
    private final ForecastMetricsService metricsService;
    private final ForecastingProperties properties;
    private final Retry trainingDivergenceRetry;

    public TrainingRun trainAndEvaluate(String ticker, Architecture architecture, HyperparameterSet hyperparameters) {
        return trainAndEvaluate(ticker, architecture, hyperparameters, null, CancellationToken.none());
    }

    public TrainingRun trainAndEvaluate(String ticker, Architecture architecture, HyperparameterSet hyperparameters,
                                        String period, CancellationToken cancellationToken) {
        if (hyperparameters != null && hyperparameters.architecture() != architecture) {
            throw new BadRequestException("Hyperparameters target " + hyperparameters.architecture()
                    + " but training was requested for " + architecture);
        }
        String resolvedPeriod = period == null || period.isBlank() ? properties.getTraining().getDefaultPeriod() : period;
        PriceSeries series = marketDataProvider.fetchPriceHistory(ticker, resolvedPeriod);
        analogueRetriever.index(series.ticker(), series.dates(), series.closes());

        boolean explicit = hyperparameters != null;
        AtomicInteger attempts = new AtomicInteger();
        AtomicReference<TrainingRun> lastRun = new AtomicReference<>();
        Supplier<TrainingRun> attempt = () -> {
            int number = attempts.incrementAndGet();
            HyperparameterSet chosen = explicit ? hyperparameters : brain.suggest(architecture);
            return runAttempt(series, chosen, explicit, number, cancellationToken, lastRun);
        };
        try {
            if (explicit) {
                return attempt.get();
            }
            return Retry.decorateSupplier(trainingDivergenceRetry, attempt).get();
        } catch (TrainingDivergedException ex) {
            log.warn("Training {} for {} diverged after {} attempt(s): {}", architecture, series.ticker(),
                    attempts.get(), ex.getMessage());
            return lastRun.get();
        }
    }

    private TrainingRun runAttempt(PriceSeries series, HyperparameterSet hyperparameters, boolean explicit,
                                   int attempt, CancellationToken cancellationToken,
                                   AtomicReference<TrainingRun> lastRun) {
        Architecture architecture = hyperparameters.architecture();
        PreparedDataset dataset = preprocessor.prepare(series.closes(), hyperparameters.sequenceLength(),
                properties.getTraining().getTrainFraction());
        ModelAdapter adapter = adapters.get(architecture);
        Instant started = Instant.now();
        TrainingRun run = runLog.open(TrainingRun.open(UUID.randomUUID().toString(), series.ticker(),
                hyperparameters, explicit, attempt, started));
        lastRun.set(run);
        log.info("Run {} started: {} on {} (attempt {}, {} train / {} held-out windows)", run.getRunId(),
                architecture, series.ticker(), attempt, dataset.train().size(), dataset.validation().size());

        TrainingRun.Status status = TrainingRun.Status.FAILED;
        try {
            ModelHandle handle = adapter.fit(dataset.train(), hyperparameters, cancellationToken);
            run.setEffectiveLayers(handle.effectiveLayers());
            double[] predictedScaled = adapter.predict(handle, dataset.validation());
            MetricSnapshot metrics = metricsEngine.evaluate(
                    preprocessor.unscale(dataset.validationTargets(), dataset.scaleParams()),
                    preprocessor.unscale(predictedScaled, dataset.scaleParams()),
                    properties.getMetrics().getTolerance());

            RegistrationResult registration;
            try {
                registration = registry.register(run, adapter, handle, metrics, dataset.scaleParams());
            } catch (ArtifactStorageException ex) {
                log.error("Run {} could not store its artifact", run.getRunId(), ex);
                TrainingRun failed = brain.record(run, TrainingRun.Status.FAILED, metrics, ex.getMessage());
                lastRun.set(failed);
                return failed;
            }
            run.setModelVersionId(registration.version().getId());
            run.setVersionStage(registration.version().getStage());
            metricsService.recordPromotion(architecture, registration.promoted());
            if (registration.promoted()) {
                if (registration.superseded() != null) {
                    calibrationStore.evict(registration.superseded().getId());
                }
                calibrationStore.put(conformalPredictor.calibrate(registration.version().getId(),
                        dataset.validationTargets(), predictedScaled));
            }
            status = TrainingRun.Status.COMPLETED;
            TrainingRun sealed = brain.record(run, status, metrics, null);
            lastRun.set(sealed);
            return sealed;
        } catch (TrainingDivergedException ex) {
            status = TrainingRun.Status.DIVERGED;
            lastRun.set(brain.record(run, status, null, ex.getMessage()));
            throw ex;
        } catch (TrainingCancelledException ex) {
            status = TrainingRun.Status.CANCELLED;
            log.info("Run {} cancelled", run.getRunId());
            TrainingRun cancelled = brain.record(run, status, null, ex.getMessage());
            lastRun.set(cancelled);
            return cancelled;
        } catch (RuntimeException ex) {
            log.error("Run {} failed", run.getRunId(), ex);
            TrainingRun failed = brain.record(run, TrainingRun.Status.FAILED, null, ex.getMessage());
            lastRun.set(failed);
            return failed;
        } finally {
            metricsService.recordRun(architecture, status, Duration.between(started, Instant.now()));
        }
    }
}
