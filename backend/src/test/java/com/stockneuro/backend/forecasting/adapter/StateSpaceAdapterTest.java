package com.stockneuro.backend.forecasting.adapter;

import com.stockneuro.backend.forecasting.data.PreparedDataset;
import com.stockneuro.backend.forecasting.data.SequencePreprocessor;
import com.stockneuro.backend.forecasting.data.Window;
import com.stockneuro.backend.util.TestSeriesFactory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StateSpaceAdapterTest {

    private static final StateSpaceAdapter adapter = new StateSpaceAdapter(new NetworkTrainer());
    private static PreparedDataset dataset;
    private static ModelHandle handle;

    @BeforeAll
    static void train() {
        dataset = new SequencePreprocessor().prepare(TestSeriesFactory.sineCloses(160, 40.0, 4.0), 12, 0.8);
        HyperparameterSet hyperparameters = HyperparameterSet.builder()
                .architecture(Architecture.STATE_SPACE)
                .sequenceLength(12)
                .hiddenUnits(6)
                .dropout(0.2)
                .learningRate(0.005)
                .epochs(3)
                .batchSize(16)
                .layers(1)
                .seed(42L)
                .build();
        handle = adapter.fit(dataset.train(), hyperparameters, CancellationToken.none());
    }

    @Test
    void streamingUpdatesMatchBatchPrediction() {
        List<Window> validation = dataset.validation();
        double[] batch = adapter.predict(handle, validation);

        StreamingSession session = adapter.openStream(handle, validation.get(0));

        assertThat(adapter.supportsStreaming()).isTrue();
        assertThat(session.currentForecast()).isCloseTo(batch[0], within(1e-6));
    }

    @Test
    void restoredModelPredictsLikeTheOriginal() {
        ModelHandle restored = adapter.restore(adapter.serialize(handle));

        double[] original = adapter.predict(handle, dataset.validation());
        double[] reloaded = adapter.predict(restored, dataset.validation());

        assertThat(restored.inputLength()).isEqualTo(12);
        for (int i = 0; i < original.length; i++) {
            assertThat(reloaded[i]).isCloseTo(original[i], within(1e-9));
        }
    }

    @Test
    void predictionsAreFinite() {
        double[] predicted = adapter.predict(handle, dataset.validation());

        assertThat(predicted).hasSize(dataset.validation().size());
        for (double value : predicted) {
            assertThat(Double.isFinite(value)).isTrue();
        }
    }
}
