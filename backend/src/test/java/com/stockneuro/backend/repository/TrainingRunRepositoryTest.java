package com.stockneuro.backend.repository;

import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.forecasting.adapter.HyperparameterSet;
import com.stockneuro.backend.forecasting.metrics.MetricSnapshot;
import com.stockneuro.backend.model.TrainingRun;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class TrainingRunRepositoryTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private TrainingRunRepository trainingRunRepository;

    @Test
    void historyIsScopedByArchitectureAndOrderedByStart() {
        Instant start = Instant.parse("2024-03-01T10:00:00Z");
        entityManager.persist(run("run-b", Architecture.LSTM, start.plusSeconds(60)));
        entityManager.persist(run("run-a", Architecture.LSTM, start));
        entityManager.persist(run("run-c", Architecture.RNN, start));
        entityManager.flush();

        assertThat(trainingRunRepository.findByArchitectureOrderByStartedAtAsc(Architecture.LSTM))
                .extracting(TrainingRun::getRunId)
                .containsExactly("run-a", "run-b");
    }

    @Test
    void sealedMetricsSurviveAReload() {
        TrainingRun run = run("run-m", Architecture.PATCH_TST, Instant.parse("2024-03-01T10:00:00Z"));
        run.applyMetrics(new MetricSnapshot(1.5, 1.2, 2.0, 2.1, 0.9, 0.8, 87.5, 0.075, 48));
        run.setStatus(TrainingRun.Status.COMPLETED);
        entityManager.persistAndFlush(run);
        entityManager.clear();

        TrainingRun loaded = trainingRunRepository.findByRunId("run-m").orElseThrow();
        assertThat(loaded.metrics()).isEqualTo(run.metrics());
        assertThat(loaded.hyperparameters()).isEqualTo(run.hyperparameters());
        assertThat(trainingRunRepository.findByArchitectureAndStatusOrderByStartedAtAsc(Architecture.PATCH_TST,
                TrainingRun.Status.COMPLETED)).hasSize(1);
    }

    private static TrainingRun run(String runId, Architecture architecture, Instant startedAt) {
        HyperparameterSet hyperparameters = HyperparameterSet.builder()
                .architecture(architecture)
                .sequenceLength(60)
                .hiddenUnits(50)
                .dropout(0.2)
                .learningRate(0.001)
                .epochs(20)
                .batchSize(32)
                .layers(1)
                .seed(42)
                .build();
        return TrainingRun.open(runId, "ACME", hyperparameters, false, 1, startedAt);
    }
}
