package com.stockneuro.backend.forecasting.adapter;

import com.stockneuro.backend.forecasting.data.PreparedDataset;
import com.stockneuro.backend.forecasting.data.Window;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.deeplearning4j.nn.conf.distribution.NormalDistribution;
import org.deeplearning4j.nn.conf.layers.recurrent.SimpleRnn;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Linear state-space forecaster: h_t = u_t B + h_{t-1} A + b, y = h_T C + d. Trained as an
 * identity-activation recurrent layer and served either in batch or one tick at a time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StateSpaceAdapter implements ModelAdapter {

    private static final double RECURRENT_INIT_STD = 0.05;

    private final NetworkTrainer trainer;

    @Override
    public Architecture architecture() {
        return Architecture.STATE_SPACE;
    }

    @Override
    public ModelHandle fit(List<Window> windows, HyperparameterSet hyperparameters, CancellationToken cancellationToken) {
        trainer.requireTrainable(windows);
        int inputLength = windows.get(0).length();
        HyperparameterSet linear = hyperparameters.toBuilder().dropout(0.0).build();
        log.info("Fitting state-space model: samples={} inputLength={} stateSize={}",
                windows.size(), inputLength, hyperparameters.hiddenUnits());
        MultiLayerNetwork network = RecurrentNetworks.stacked(linear, 1, inputLength,
                () -> new SimpleRnn.Builder()
                        .nOut(hyperparameters.hiddenUnits())
                        .activation(Activation.IDENTITY)
                        .weightInitRecurrent(new NormalDistribution(0.0, RECURRENT_INIT_STD))
                        .build());
        trainer.fit(network, trainer.recurrentFeatures(windows),
                trainer.labels(PreparedDataset.targets(windows)), linear, cancellationToken);
        return new NetworkModelHandle(Architecture.STATE_SPACE, network, inputLength, 1);
    }

    @Override
    public double[] predict(ModelHandle handle, List<Window> windows) {
        NetworkModelHandle network = trainer.requireNetworkHandle(handle, Architecture.STATE_SPACE);
        trainer.requireInputLength(handle, windows);
        if (windows.isEmpty()) {
            return new double[0];
        }
        return trainer.output(network.network(), trainer.recurrentFeatures(windows));
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    @Override
    public StreamingSession openStream(ModelHandle handle, Window seed) {
        NetworkModelHandle network = trainer.requireNetworkHandle(handle, Architecture.STATE_SPACE);
        trainer.requireInputLength(handle, List.of(seed));
        LinearStateSession session = new LinearStateSession(network.network());
        for (double value : seed.values()) {
            session.update(value);
        }
        return session;
    }

    @Override
    public byte[] serialize(ModelHandle handle) {
        return trainer.write(trainer.requireNetworkHandle(handle, Architecture.STATE_SPACE));
    }

    @Override
    public ModelHandle restore(byte[] artifact) {
        return trainer.read(artifact, Architecture.STATE_SPACE);
    }

    static final class LinearStateSession implements StreamingSession {

        private final double[] inputWeights;
        private final double[][] recurrentWeights;
        private final double[] bias;
        private final double[] outputWeights;
        private final double outputBias;
        private double[] state;
        private double forecast;

        LinearStateSession(MultiLayerNetwork network) {
            INDArray w = network.getLayer(0).getParam("W");
            INDArray rw = network.getLayer(0).getParam("RW");
            INDArray b = network.getLayer(0).getParam("b");
            INDArray outW = network.getLayer(1).getParam("W");
            INDArray outB = network.getLayer(1).getParam("b");
            int size = (int) rw.size(0);
            inputWeights = new double[size];
            recurrentWeights = new double[size][size];
            bias = new double[size];
            outputWeights = new double[size];
            for (int j = 0; j < size; j++) {
                inputWeights[j] = w.getDouble(j);
                bias[j] = b.getDouble(j);
                outputWeights[j] = outW.getDouble(j);
                for (int k = 0; k < size; k++) {
                    recurrentWeights[k][j] = rw.getDouble(k, j);
                }
            }
            outputBias = outB.getDouble(0);
            state = new double[size];
        }

        @Override
        public synchronized double update(double observation) {
            double[] next = new double[state.length];
            for (int j = 0; j < next.length; j++) {
                double value = observation * inputWeights[j] + bias[j];
                for (int k = 0; k < state.length; k++) {
                    value += state[k] * recurrentWeights[k][j];
                }
                next[j] = value;
            }
            state = next;
            double output = outputBias;
            for (int j = 0; j < state.length; j++) {
                output += state[j] * outputWeights[j];
            }
            forecast = output;
            return forecast;
        }

        @Override
        public synchronized double currentForecast() {
            return forecast;
        }
    }
}
