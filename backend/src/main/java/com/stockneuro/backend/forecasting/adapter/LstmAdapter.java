package com.stockneuro.backend.forecasting.adapter;

import com.stockneuro.backend.forecasting.data.PreparedDataset;
import com.stockneuro.backend.forecasting.data.Window;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.deeplearning4j.nn.conf.layers.LSTM;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.nd4j.linalg.activations.Activation;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class LstmAdapter implements ModelAdapter {

    private final NetworkTrainer trainer;
    private final LayerDepthPolicy depthPolicy;

    @Override
    public Architecture architecture() {
        return Architecture.LSTM;
    }

    @Override
    public ModelHandle fit(List<Window> windows, HyperparameterSet hyperparameters, CancellationToken cancellationToken) {
        trainer.requireTrainable(windows);
        int inputLength = windows.get(0).length();
        int depth = depthPolicy.effectiveDepth(windows.size(), hyperparameters.layers());
        log.info("Fitting LSTM: samples={} inputLength={} depth={} (requested {})",
                windows.size(), inputLength, depth, hyperparameters.layers());
        MultiLayerNetwork network = RecurrentNetworks.stacked(hyperparameters, depth, inputLength,
                () -> new LSTM.Builder().nOut(hyperparameters.hiddenUnits()).activation(Activation.TANH).build());
        trainer.fit(network, trainer.recurrentFeatures(windows),
                trainer.labels(PreparedDataset.targets(windows)), hyperparameters, cancellationToken);
        return new NetworkModelHandle(Architecture.LSTM, network, inputLength, depth);
    }

    @Override
    public double[] predict(ModelHandle handle, List<Window> windows) {
        NetworkModelHandle network = trainer.requireNetworkHandle(handle, Architecture.LSTM);
        trainer.requireInputLength(handle, windows);
        if (windows.isEmpty()) {
            return new double[0];
        }
        return trainer.output(network.network(), trainer.recurrentFeatures(windows));
    }

    @Override
    public boolean supportsStreaming() {
        return false;
    }

    @Override
    public byte[] serialize(ModelHandle handle) {
        return trainer.write(trainer.requireNetworkHandle(handle, Architecture.LSTM));
    }

    @Override
    public ModelHandle restore(byte[] artifact) {
        return trainer.read(artifact, Architecture.LSTM);
    }
}
