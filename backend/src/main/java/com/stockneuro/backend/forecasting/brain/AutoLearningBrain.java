package com.stockneuro.backend.forecasting.brain;

import com.stockneuro.backend.config.ForecastingProperties;
import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.forecasting.adapter.HyperparameterSet;
import com.stockneuro.backend.forecasting.metrics.MetricSnapshot;
import com.stockneuro.backend.model.TrainingRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Hill-climbing hyperparameter search: start from the best completed run of an
 * architecture and move one step along a single dimension, steering away from
 * configurations that diverged or failed.
 */
@Component
@Slf4j
public class AutoLearningBrain {

    static final int SEQUENCE_STEP = 10;
    static final int HIDDEN_STEP = 16;
    static final double DROPOUT_STEP = 0.05;
    static final double MAX_DROPOUT = 0.9;

    private static final Comparator<TrainingRun> BY_QUALITY = Comparator
            .comparing(TrainingRun::getToleranceAccuracy)
            .thenComparing(run -> run.getRmse() == null ? Double.NEGATIVE_INFINITY : -run.getRmse());

    private final TrainingRunLog runLog;
    private final ForecastingProperties properties;
    private final Random random;

    @Autowired
    public AutoLearningBrain(TrainingRunLog runLog, ForecastingProperties properties) {
        this(runLog, properties, new Random());
    }

    AutoLearningBrain(TrainingRunLog runLog, ForecastingProperties properties, Random random) {
        this.runLog = runLog;
        this.properties = properties;
        this.random = random;
    }

    public HyperparameterSet suggest(Architecture architecture) {
        List<TrainingRun> history = runLog.history(architecture).stream()
                .filter(TrainingRun::isSealed)
                .collect(Collectors.toList());
        if (history.isEmpty()) {
            log.info("No history for {}, suggesting defaults", architecture);
            return defaults(architecture);
        }
        Optional<TrainingRun> best = history.stream()
                .filter(run -> run.getStatus() == TrainingRun.Status.COMPLETED)
                .filter(run -> run.getToleranceAccuracy() != null)
                .max(BY_QUALITY);
        HyperparameterSet base = best.map(TrainingRun::hyperparameters).orElseGet(() -> defaults(architecture));

        double divergedLearningRate = history.stream()
                .filter(run -> run.getStatus() == TrainingRun.Status.DIVERGED)
                .mapToDouble(TrainingRun::getLearningRate)
                .min()
                .orElse(Double.POSITIVE_INFINITY);
        Set<HyperparameterSet> failed = history.stream()
                .filter(run -> run.getStatus() == TrainingRun.Status.DIVERGED
                        || run.getStatus() == TrainingRun.Status.FAILED)
                .map(run -> region(run.hyperparameters()))
                .collect(Collectors.toSet());
        Set<HyperparameterSet> tried = history.stream()
                .map(run -> region(run.hyperparameters()))
                .collect(Collectors.toSet());

        List<HyperparameterSet> safe = neighbours(base).stream()
                .filter(candidate -> candidate.learningRate() < divergedLearningRate)
                .filter(candidate -> !failed.contains(region(candidate)))
                .collect(Collectors.toList());
        if (safe.isEmpty()) {
            double learningRate = Math.min(base.learningRate(), divergedLearningRate) / 2.0;
            HyperparameterSet fallback = base.toBuilder().learningRate(learningRate).build();
            log.info("All neighbours of {} fall in a failed region, lowering learning rate to {}",
                    architecture, fallback.learningRate());
            return fallback;
        }
        List<HyperparameterSet> untried = safe.stream()
                .filter(candidate -> !tried.contains(region(candidate)))
                .collect(Collectors.toList());
        List<HyperparameterSet> pool = untried.isEmpty() ? safe : untried;
        HyperparameterSet suggestion = pool.get(random.nextInt(pool.size()));
        log.info("Suggesting {} for {} (base from {} runs)", suggestion, architecture, history.size());
        return suggestion;
    }

    public HyperparameterSet defaults(Architecture architecture) {
        ForecastingProperties.Defaults defaults = properties.getTraining().getDefaults();
        return HyperparameterSet.builder()
                .architecture(architecture)
                .sequenceLength(defaults.getSequenceLength())
                .hiddenUnits(defaults.getHiddenUnits())
                .dropout(defaults.getDropout())
                .learningRate(defaults.getLearningRate())
                .epochs(defaults.getEpochs())
                .batchSize(defaults.getBatchSize())
                .layers(defaults.getLayers())
                .seed(defaults.getSeed())
                .build();
    }

    public TrainingRun record(TrainingRun run, TrainingRun.Status status, MetricSnapshot metrics, String errorMessage) {
        TrainingRun sealed = runLog.seal(run, status, metrics, errorMessage, Instant.now());
        log.info("Recorded run {} for {} as {}", sealed.getRunId(), sealed.getArchitecture(), status);
        return sealed;
    }

    List<HyperparameterSet> neighbours(HyperparameterSet base) {
        List<HyperparameterSet> neighbours = new ArrayList<>();
        if (base.sequenceLength() - SEQUENCE_STEP >= 2) {
            neighbours.add(base.toBuilder().sequenceLength(base.sequenceLength() - SEQUENCE_STEP).build());
        }
        neighbours.add(base.toBuilder().sequenceLength(base.sequenceLength() + SEQUENCE_STEP).build());
        neighbours.add(base.toBuilder().learningRate(base.learningRate() * 2.0).build());
        neighbours.add(base.toBuilder().learningRate(base.learningRate() / 2.0).build());
        if (base.hiddenUnits() - HIDDEN_STEP >= 1) {
            neighbours.add(base.toBuilder().hiddenUnits(base.hiddenUnits() - HIDDEN_STEP).build());
        }
        neighbours.add(base.toBuilder().hiddenUnits(base.hiddenUnits() + HIDDEN_STEP).build());
        if (base.dropout() - DROPOUT_STEP >= 0.0) {
            neighbours.add(base.toBuilder().dropout(round(base.dropout() - DROPOUT_STEP)).build());
        }
        if (base.dropout() + DROPOUT_STEP <= MAX_DROPOUT) {
            neighbours.add(base.toBuilder().dropout(round(base.dropout() + DROPOUT_STEP)).build());
        }
        if (base.batchSize() > 1) {
            neighbours.add(base.toBuilder().batchSize(base.batchSize() / 2).build());
        }
        neighbours.add(base.toBuilder().batchSize(base.batchSize() * 2).build());
        return neighbours;
    }

    private static HyperparameterSet region(HyperparameterSet hyperparameters) {
        return hyperparameters.toBuilder().seed(0L).build();
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
