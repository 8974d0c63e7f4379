package com.stockneuro.backend.forecasting.brain;

import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.forecasting.metrics.MetricSnapshot;
import com.stockneuro.backend.model.TrainingRun;
import com.stockneuro.backend.repository.TrainingRunRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only log of training runs keyed by architecture and run id. A run is written
 * once when it opens and once when it is sealed.
 */
@Component
@RequiredArgsConstructor
public class TrainingRunLog {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final TrainingRunRepository repository;

    public TrainingRun open(TrainingRun run) {
        if (run.getStatus() != TrainingRun.Status.RUNNING) {
            throw new IllegalStateException("Run " + run.getRunId() + " must open in RUNNING state");
        }
        return repository.save(run);
    }

    public TrainingRun seal(TrainingRun run, TrainingRun.Status status, MetricSnapshot metrics,
                            String errorMessage, Instant completedAt) {
        if (run.isSealed()) {
            throw new IllegalStateException("Run " + run.getRunId() + " is already sealed as " + run.getStatus());
        }
        if (status == TrainingRun.Status.RUNNING) {
            throw new IllegalArgumentException("A run cannot be sealed as RUNNING");
        }
        if (metrics != null) {
            run.applyMetrics(metrics);
        }
        run.setStatus(status);
        run.setErrorMessage(truncate(errorMessage));
        run.setCompletedAt(completedAt);
        return repository.save(run);
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }

    public List<TrainingRun> history(Architecture architecture) {
        return repository.findByArchitectureOrderByStartedAtAsc(architecture);
    }

    public Optional<TrainingRun> find(String runId) {
        return repository.findByRunId(runId);
    }
}
