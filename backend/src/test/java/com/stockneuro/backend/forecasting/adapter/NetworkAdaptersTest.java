package com.stockneuro.backend.forecasting.adapter;

import com.stockneuro.backend.config.ForecastingProperties;
import com.stockneuro.backend.exception.InsufficientDataException;
import com.stockneuro.backend.exception.TrainingCancelledException;
import com.stockneuro.backend.forecasting.data.PreparedDataset;
import com.stockneuro.backend.forecasting.data.SequencePreprocessor;
import com.stockneuro.backend.util.TestSeriesFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class NetworkAdaptersTest {

    private final ForecastingProperties properties = new ForecastingProperties();
    private final NetworkTrainer trainer = new NetworkTrainer();
    private final LayerDepthPolicy depthPolicy = new LayerDepthPolicy(properties);
    private final PreparedDataset dataset = new SequencePreprocessor()
            .prepare(TestSeriesFactory.sineCloses(200, 60.0, 6.0), 16, 0.8);

    @Test
    void everyTrainableArchitectureFitsPredictsAndRoundTrips() {
        List<ModelAdapter> adapters = List.of(
                new LstmAdapter(trainer, depthPolicy),
                new SimpleRnnAdapter(trainer, depthPolicy),
                new PatchTstAdapter(trainer, depthPolicy, properties));

        for (ModelAdapter adapter : adapters) {
            ModelHandle handle = adapter.fit(dataset.train(), hyperparameters(adapter.architecture(), 1),
                    CancellationToken.none());
            double[] predicted = adapter.predict(handle, dataset.validation());
            double[] restored = adapter.predict(adapter.restore(adapter.serialize(handle)), dataset.validation());

            assertThat(handle.architecture()).isEqualTo(adapter.architecture());
            assertThat(predicted).hasSize(dataset.validation().size());
            for (int i = 0; i < predicted.length; i++) {
                assertThat(Double.isFinite(predicted[i])).isTrue();
                assertThat(restored[i]).isCloseTo(predicted[i], within(1e-9));
            }
        }
    }

    @Test
    void stackedDepthAppliesOnlyAboveSampleThreshold() {
        LstmAdapter adapter = new LstmAdapter(trainer, depthPolicy);

        ModelHandle deep = adapter.fit(dataset.train(), hyperparameters(Architecture.LSTM, 2), CancellationToken.none());
        ModelHandle shallow = adapter.fit(dataset.train().subList(0, 80), hyperparameters(Architecture.LSTM, 2),
                CancellationToken.none());

        assertThat(deep.effectiveLayers()).isEqualTo(2);
        assertThat(shallow.effectiveLayers()).isEqualTo(1);
    }

    @Test
    void cancelledTokenStopsTraining() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThatThrownBy(() -> new SimpleRnnAdapter(trainer, depthPolicy)
                .fit(dataset.train(), hyperparameters(Architecture.RNN, 1), token))
                .isInstanceOf(TrainingCancelledException.class);
    }

    @Test
    void emptyTrainingSetIsRejected() {
        assertThatThrownBy(() -> new LstmAdapter(trainer, depthPolicy)
                .fit(List.of(), hyperparameters(Architecture.LSTM, 1), CancellationToken.none()))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void restoringAnotherArchitecturesArtifactFails() {
        LstmAdapter lstm = new LstmAdapter(trainer, depthPolicy);
        ModelHandle handle = lstm.fit(dataset.train(), hyperparameters(Architecture.LSTM, 1), CancellationToken.none());
        byte[] artifact = lstm.serialize(handle);

        assertThatThrownBy(() -> new SimpleRnnAdapter(trainer, depthPolicy).restore(artifact))
                .isInstanceOf(com.stockneuro.backend.exception.ArtifactStorageException.class);
    }

    private static HyperparameterSet hyperparameters(Architecture architecture, int layers) {
        return HyperparameterSet.builder()
                .architecture(architecture)
                .sequenceLength(16)
                .hiddenUnits(8)
                .dropout(0.1)
                .learningRate(0.005)
                .epochs(2)
                .batchSize(32)
                .layers(layers)
                .seed(7L)
                .build();
    }
}
