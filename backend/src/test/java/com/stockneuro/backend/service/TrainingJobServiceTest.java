package com.stockneuro.backend.service;

import com.stockneuro.backend.exception.NotFoundException;
import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.forecasting.adapter.CancellationToken;
import com.stockneuro.backend.model.TrainingRun;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TrainingJobServiceTest {

    private final ForecastPipelineService pipeline = mock(ForecastPipelineService.class);

    @Test
    void finishedJobCarriesTheRun() {
        TrainingRun run = TrainingRun.builder().runId("run-1").status(TrainingRun.Status.COMPLETED).build();
        when(pipeline.trainAndEvaluate(eq("ACME"), eq(Architecture.LSTM), isNull(), eq("1y"), any(CancellationToken.class)))
                .thenReturn(run);
        TrainingJobService service = new TrainingJobService(pipeline, Runnable::run);

        TrainingJobService.TrainingJob job = service.submit("ACME", Architecture.LSTM, null, "1y");

        assertThat(service.get(job.getJobId()).getState()).isEqualTo(TrainingJobService.TrainingJob.State.FINISHED);
        assertThat(job.getRun()).isSameAs(run);
        assertThat(job.getCompletedAt()).isNotNull();
    }

    @Test
    void cancellingAQueuedJobSkipsTraining() {
        List<Runnable> queue = new ArrayList<>();
        Executor deferred = queue::add;
        TrainingJobService service = new TrainingJobService(pipeline, deferred);

        TrainingJobService.TrainingJob job = service.submit("ACME", Architecture.LSTM, null, "1y");
        service.cancel(job.getJobId());
        queue.forEach(Runnable::run);

        assertThat(job.getState()).isEqualTo(TrainingJobService.TrainingJob.State.CANCELLED);
        assertThat(job.cancellationToken().isCancelled()).isTrue();
        verify(pipeline, never()).trainAndEvaluate(any(), any(), any(), any(), any());
    }

    @Test
    void pipelineFailureMarksJobFailed() {
        when(pipeline.trainAndEvaluate(any(), any(), any(), any(), any()))
                .thenThrow(new IllegalStateException("no data"));
        TrainingJobService service = new TrainingJobService(pipeline, Runnable::run);

        TrainingJobService.TrainingJob job = service.submit("ACME", Architecture.RNN, null, "1y");

        assertThat(job.getState()).isEqualTo(TrainingJobService.TrainingJob.State.FAILED);
        assertThat(job.getErrorMessage()).isEqualTo("no data");
    }

    @Test
    void rejectedHandOffMarksJobFailed() {
        Executor saturated = task -> {
            throw new TaskRejectedException("queue capacity reached");
        };
        TrainingJobService service = new TrainingJobService(pipeline, saturated);

        TrainingJobService.TrainingJob job = service.submit("ACME", Architecture.LSTM, null, "1y");

        assertThat(service.get(job.getJobId()).getState()).isEqualTo(TrainingJobService.TrainingJob.State.FAILED);
        assertThat(job.getErrorMessage()).isEqualTo("Training queue is full");
        assertThat(job.getCompletedAt()).isNotNull();
        verify(pipeline, never()).trainAndEvaluate(any(), any(), any(), any(), any());
    }

    @Test
    void completedJobsAreEvictedAndPendingOnesKept() {
        List<Runnable> queue = new ArrayList<>();
        Executor deferred = queue::add;
        TrainingJobService service = new TrainingJobService(pipeline, deferred);
        TrainingJobService.TrainingJob pending = service.submit("ACME", Architecture.LSTM, null, "1y");
        TrainingJobService.TrainingJob cancelled = service.submit("ACME", Architecture.RNN, null, "1y");
        service.cancel(cancelled.getJobId());

        int evicted = service.evictCompletedBefore(Instant.now().plusSeconds(1));

        assertThat(evicted).isEqualTo(1);
        assertThat(service.get(pending.getJobId())).isSameAs(pending);
        assertThatThrownBy(() -> service.get(cancelled.getJobId())).isInstanceOf(NotFoundException.class);
    }

    @Test
    void recentlyCompletedJobsSurviveTheSweep() {
        TrainingJobService service = new TrainingJobService(pipeline, Runnable::run);
        when(pipeline.trainAndEvaluate(any(), any(), any(), any(), any()))
                .thenThrow(new IllegalStateException("no data"));
        TrainingJobService.TrainingJob job = service.submit("ACME", Architecture.RNN, null, "1y");

        service.evictFinishedJobs();

        assertThat(service.get(job.getJobId())).isSameAs(job);
    }

    @Test
    void unknownJobIsNotFound() {
        TrainingJobService service = new TrainingJobService(pipeline, Runnable::run);

        assertThatThrownBy(() -> service.get("missing")).isInstanceOf(NotFoundException.class);
    }
}
