package com.stockneuro.backend.service;

import com.stockneuro.backend.exception.NotFoundException;
import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.forecasting.adapter.CancellationToken;
import com.stockneuro.backend.forecasting.adapter.HyperparameterSet;
import com.stockneuro.backend.model.TrainingRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs train_and_evaluate on the training pool as cancellable background jobs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrainingJobService {

    private static final Duration RETENTION = Duration.ofHours(1);

    private final ForecastPipelineService pipelineService;

    @Qualifier("trainingExecutor")
    private final Executor trainingExecutor;

    private final Map<String, TrainingJob> jobs = new ConcurrentHashMap<>();

    public TrainingJob submit(String ticker, Architecture architecture, HyperparameterSet hyperparameters, String period) {
        TrainingJob job = new TrainingJob(UUID.randomUUID().toString(), ticker, architecture, Instant.now());
        jobs.put(job.getJobId(), job);
        try {
            trainingExecutor.execute(() -> execute(job, hyperparameters, period));
        } catch (RejectedExecutionException ex) {
            log.warn("Training queue rejected job {} ({} on {})", job.getJobId(), architecture, ticker);
            job.fail("Training queue is full");
            return job;
        }
        log.info("Queued training job {} ({} on {})", job.getJobId(), architecture, ticker);
        return job;
    }

    @Scheduled(fixedDelayString = "${stockneuro.executor.training.job-sweep-interval-ms:300000}")
    public void evictFinishedJobs() {
        int evicted = evictCompletedBefore(Instant.now().minus(RETENTION));
        if (evicted > 0) {
            log.info("Evicted {} completed training jobs", evicted);
        }
    }

    int evictCompletedBefore(Instant cutoff) {
        int before = jobs.size();
        jobs.values().removeIf(job -> job.getCompletedAt() != null && job.getCompletedAt().isBefore(cutoff));
        return before - jobs.size();
    }

    public TrainingJob get(String jobId) {
        TrainingJob job = jobs.get(jobId);
        if (job == null) {
            throw new NotFoundException("Training job not found: " + jobId);
        }
        return job;
    }

    public TrainingJob cancel(String jobId) {
        TrainingJob job = get(jobId);
        job.cancel();
        log.info("Cancellation requested for training job {}", jobId);
        return job;
    }

    private void execute(TrainingJob job, HyperparameterSet hyperparameters, String period) {
        if (!job.start()) {
            return;
        }
        try {
            TrainingRun run = pipelineService.trainAndEvaluate(job.getTicker(), job.getArchitecture(),
                    hyperparameters, period, job.cancellationToken());
            job.finish(run);
        } catch (RuntimeException ex) {
            log.error("Training job {} failed", job.getJobId(), ex);
            job.fail(ex.getMessage());
        }
    }

    public static class TrainingJob {

        private final String jobId;
        private final String ticker;
        private final Architecture architecture;
        private final Instant submittedAt;
        private final CancellationToken cancellationToken = new CancellationToken();

        private volatile State state = State.QUEUED;
        private volatile TrainingRun run;
        private volatile String errorMessage;
        private volatile Instant completedAt;

        TrainingJob(String jobId, String ticker, Architecture architecture, Instant submittedAt) {
            this.jobId = jobId;
            this.ticker = ticker;
            this.architecture = architecture;
            this.submittedAt = submittedAt;
        }

        synchronized boolean start() {
            if (state == State.CANCELLED) {
                return false;
            }
            state = State.RUNNING;
            return true;
        }

        synchronized void cancel() {
            cancellationToken.cancel();
            if (state == State.QUEUED) {
                state = State.CANCELLED;
                completedAt = Instant.now();
            }
        }

        synchronized void finish(TrainingRun run) {
            this.run = run;
            this.state = run.getStatus() == TrainingRun.Status.CANCELLED ? State.CANCELLED : State.FINISHED;
            this.completedAt = Instant.now();
        }

        synchronized void fail(String message) {
            this.errorMessage = message;
            this.state = State.FAILED;
            this.completedAt = Instant.now();
        }

        CancellationToken cancellationToken() {
            return cancellationToken;
        }

        public String getJobId() {
            return jobId;
        }

        public String getTicker() {
            return ticker;
        }

        public Architecture getArchitecture() {
            return architecture;
        }

        public Instant getSubmittedAt() {
            return submittedAt;
        }

        public State getState() {
            return state;
        }

        public TrainingRun getRun() {
            return run;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        public Instant getCompletedAt() {
            return completedAt;
        }

        public enum State {
            QUEUED,
            RUNNING,
            FINISHED,
            FAILED,
            CANCELLED
        }
    }
}
