package com.stockneuro.backend.forecasting.registry;

import com.stockneuro.backend.config.ForecastingProperties;
import com.stockneuro.backend.exception.ArtifactStorageException;
import com.stockneuro.backend.exception.NotFoundException;
import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.forecasting.adapter.HyperparameterSet;
import com.stockneuro.backend.forecasting.adapter.ModelAdapter;
import com.stockneuro.backend.forecasting.adapter.ModelHandle;
import com.stockneuro.backend.forecasting.data.ScaleParams;
import com.stockneuro.backend.forecasting.metrics.MetricSnapshot;
import com.stockneuro.backend.model.ModelVersion;
import com.stockneuro.backend.model.TrainingRun;
import com.stockneuro.backend.repository.ModelVersionRepository;
import com.stockneuro.backend.util.InMemoryModelVersions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ModelRegistryServiceTest {

    @TempDir
    Path artifactDir;

    private ModelVersionRepository repository;
    private ModelAdapter adapter;
    private ModelHandle handle;
    private ModelRegistryService registry;

    @BeforeEach
    void setUp() {
        ForecastingProperties properties = new ForecastingProperties();
        properties.getRegistry().setArtifactDir(artifactDir.toString());
        repository = InMemoryModelVersions.repository();
        adapter = mock(ModelAdapter.class);
        handle = mock(ModelHandle.class);
        when(adapter.serialize(any())).thenReturn(new byte[]{1, 2, 3});
        when(handle.inputLength()).thenReturn(60);
        when(handle.effectiveLayers()).thenReturn(1);
        registry = new ModelRegistryService(repository, new FileSystemArtifactStore(properties),
                new SafePromotionPolicy(), new TransactionTemplate(mock(PlatformTransactionManager.class)));
    }

    @Test
    void firstCandidateIsPromotedAndArtifactIsReadable() {
        RegistrationResult result = register(61.0);

        assertThat(result.promoted()).isTrue();
        assertThat(result.superseded()).isNull();
        ModelVersion version = result.version();
        assertThat(version.getVersionNumber()).isEqualTo(1);
        assertThat(version.getStage()).isEqualTo(ModelVersion.Stage.PROMOTED);
        assertThat(version.getPromotedAt()).isNotNull();
        assertThat(registry.loadArtifact(version)).containsExactly(1, 2, 3);
        assertThat(registry.requirePromoted(Architecture.LSTM).getId()).isEqualTo(version.getId());
    }

    @Test
    void lowerScoringCandidateIsRejectedAndIncumbentKeepsServing() {
        ModelVersion incumbent = register(70.0).version();

        RegistrationResult result = register(65.0);

        assertThat(result.promoted()).isFalse();
        assertThat(result.version().getStage()).isEqualTo(ModelVersion.Stage.REJECTED);
        assertThat(result.version().getRejectionReason()).contains("does not beat");
        assertThat(registry.requirePromoted(Architecture.LSTM).getId()).isEqualTo(incumbent.getId());
    }

    @Test
    void betterCandidateSupersedesIncumbent() {
        ModelVersion incumbent = register(70.0).version();

        RegistrationResult result = register(75.0);

        assertThat(result.promoted()).isTrue();
        assertThat(result.superseded().getId()).isEqualTo(incumbent.getId());
        assertThat(incumbent.isPromoted()).isFalse();
        assertThat(incumbent.getSupersededByVersion()).isEqualTo(2);
        assertThat(registry.promotedVersion(Architecture.LSTM)).map(ModelVersion::getVersionNumber).contains(2);
    }

    @Test
    void promotedScoreNeverDecreases() {
        double[] accuracies = {50.0, 60.0, 55.0, 60.0, 72.5, 40.0, 72.5, 73.0};
        double served = Double.NEGATIVE_INFINITY;
        for (double accuracy : accuracies) {
            register(accuracy);
            double current = registry.requirePromoted(Architecture.LSTM).getToleranceAccuracy();
            assertThat(current).isGreaterThanOrEqualTo(served);
            served = current;
        }
        assertThat(served).isEqualTo(73.0);
        assertThat(registry.listVersions(Architecture.LSTM)).extracting(ModelVersion::getVersionNumber)
                .containsExactly(1, 2, 3, 4, 5, 6, 7, 8);
    }

    @Test
    void architecturesPromoteIndependently() {
        register(80.0);

        RegistrationResult rnn = register(Architecture.RNN, 20.0);

        assertThat(rnn.promoted()).isTrue();
        assertThat(rnn.version().getVersionNumber()).isEqualTo(1);
        assertThat(registry.requirePromoted(Architecture.LSTM).getToleranceAccuracy()).isEqualTo(80.0);
    }

    @Test
    void concurrentRegistrationsLeaveExactlyOnePromotedVersion() throws Exception {
        int candidates = 12;
        ExecutorService pool = Executors.newFixedThreadPool(6);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<RegistrationResult>> futures = new ArrayList<>();
        for (int i = 0; i < candidates; i++) {
            double accuracy = 40.0 + (i * 7) % 13;
            futures.add(pool.submit(() -> {
                start.await();
                return register(accuracy);
            }));
        }
        start.countDown();
        double best = Double.NEGATIVE_INFINITY;
        for (Future<RegistrationResult> future : futures) {
            best = Math.max(best, future.get(30, TimeUnit.SECONDS).version().getToleranceAccuracy());
        }
        pool.shutdown();

        List<ModelVersion> versions = registry.listVersions(Architecture.LSTM);
        assertThat(versions).hasSize(candidates);
        assertThat(versions).extracting(ModelVersion::getVersionNumber).doesNotHaveDuplicates();
        assertThat(versions).filteredOn(ModelVersion::isPromoted).hasSize(1);
        assertThat(registry.requirePromoted(Architecture.LSTM).getToleranceAccuracy()).isEqualTo(best);
    }

    @Test
    void serializationFailureRegistersNothing() {
        when(adapter.serialize(any())).thenThrow(new IllegalStateException("disk full"));

        assertThatThrownBy(() -> register(90.0))
                .isInstanceOf(ArtifactStorageException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(registry.listVersions(Architecture.LSTM)).isEmpty();
        assertThatThrownBy(() -> registry.requirePromoted(Architecture.LSTM))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void storeFailureRegistersNothing() {
        ArtifactStore failing = mock(ArtifactStore.class);
        when(failing.store(any(), anyInt(), any(), any()))
                .thenThrow(new ArtifactStorageException("read-only volume"));
        ModelRegistryService failingRegistry = new ModelRegistryService(repository, failing,
                new SafePromotionPolicy(), new TransactionTemplate(mock(PlatformTransactionManager.class)));

        assertThatThrownBy(() -> failingRegistry.register(run(Architecture.LSTM), adapter, handle,
                metrics(90.0), new ScaleParams(1.0, 2.0)))
                .isInstanceOf(ArtifactStorageException.class);
        assertThat(failingRegistry.listVersions(Architecture.LSTM)).isEmpty();
    }

    private RegistrationResult register(double accuracy) {
        return register(Architecture.LSTM, accuracy);
    }

    private RegistrationResult register(Architecture architecture, double accuracy) {
        return registry.register(run(architecture), adapter, handle, metrics(accuracy), new ScaleParams(10.0, 20.0));
    }

    private static TrainingRun run(Architecture architecture) {
        HyperparameterSet hyperparameters = HyperparameterSet.builder()
                .architecture(architecture)
                .sequenceLength(60)
                .hiddenUnits(50)
                .dropout(0.2)
                .learningRate(0.001)
                .epochs(20)
                .batchSize(32)
                .layers(1)
                .seed(42L)
                .build();
        return TrainingRun.open(UUID.randomUUID().toString(), "ACME", hyperparameters, false, 1, Instant.now());
    }

    private static MetricSnapshot metrics(double accuracy) {
        return new MetricSnapshot(2.0, 1.5, 1.2, 1.2, 0.9, 0.8, accuracy, 0.075, 48);
    }
}
