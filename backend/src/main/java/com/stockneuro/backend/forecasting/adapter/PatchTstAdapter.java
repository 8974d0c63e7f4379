package com.stockneuro.backend.forecasting.adapter;

import com.stockneuro.backend.config.ForecastingProperties;
import com.stockneuro.backend.forecasting.data.Window;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.deeplearning4j.nn.conf.NeuralNetConfiguration;
import org.deeplearning4j.nn.conf.inputs.InputType;
import org.deeplearning4j.nn.conf.layers.DenseLayer;
import org.deeplearning4j.nn.conf.layers.DropoutLayer;
import org.deeplearning4j.nn.conf.layers.GlobalPoolingLayer;
import org.deeplearning4j.nn.conf.layers.OutputLayer;
import org.deeplearning4j.nn.conf.layers.PoolingType;
import org.deeplearning4j.nn.conf.layers.SelfAttentionLayer;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.nd4j.linalg.lossfunctions.LossFunctions;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Patch-segmented attention forecaster. Each window is instance-normalized, cut into
 * overlapping patches and the patches attend to each other as a short sequence.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PatchTstAdapter implements ModelAdapter {

    private static final double MIN_STD = 1e-5;

    private final NetworkTrainer trainer;
    private final LayerDepthPolicy depthPolicy;
    private final ForecastingProperties properties;

    @Override
    public Architecture architecture() {
        return Architecture.PATCH_TST;
    }

    @Override
    public ModelHandle fit(List<Window> windows, HyperparameterSet hyperparameters, CancellationToken cancellationToken) {
        trainer.requireTrainable(windows);
        int inputLength = windows.get(0).length();
        ForecastingProperties.PatchTst config = properties.getModels().getPatchTst();
        PatchLayout layout = PatchLayout.forInput(inputLength, config.getPatchLength(), config.getStride());
        int depth = depthPolicy.effectiveDepth(windows.size(), hyperparameters.layers());
        int heads = Math.max(1, config.getHeads());
        int modelWidth = ((hyperparameters.hiddenUnits() + heads - 1) / heads) * heads;
        log.info("Fitting PatchTST: samples={} patches={}x{} depth={} width={}",
                windows.size(), layout.patchCount(), layout.patchLength(), depth, modelWidth);

        NeuralNetConfiguration.ListBuilder list = RecurrentNetworks.baseConfiguration(hyperparameters);
        for (int i = 0; i < depth; i++) {
            list.layer(new SelfAttentionLayer.Builder()
                    .nOut(modelWidth)
                    .nHeads(heads)
                    .projectInput(true)
                    .build());
        }
        list.layer(new GlobalPoolingLayer.Builder(PoolingType.AVG).build());
        list.layer(new DenseLayer.Builder().nOut(modelWidth).activation(Activation.RELU).build());
        if (hyperparameters.dropout() > 0.0) {
            list.layer(new DropoutLayer.Builder().dropOut(1.0 - hyperparameters.dropout()).build());
        }
        list.layer(new OutputLayer.Builder(LossFunctions.LossFunction.MSE)
                .nOut(1)
                .activation(Activation.IDENTITY)
                .build());
        list.setInputType(InputType.recurrent(layout.patchLength(), layout.patchCount()));
        MultiLayerNetwork network = new MultiLayerNetwork(list.build());
        network.init();

        double[] normalizedTargets = new double[windows.size()];
        for (int i = 0; i < windows.size(); i++) {
            Window window = windows.get(i);
            double[] stats = instanceStats(window.values());
            normalizedTargets[i] = (window.target() - stats[0]) / stats[1];
        }
        trainer.fit(network, features(windows, layout), trainer.labels(normalizedTargets),
                hyperparameters, cancellationToken);
        return new NetworkModelHandle(Architecture.PATCH_TST, network, inputLength, depth, layout);
    }

    @Override
    public double[] predict(ModelHandle handle, List<Window> windows) {
        NetworkModelHandle network = trainer.requireNetworkHandle(handle, Architecture.PATCH_TST);
        trainer.requireInputLength(handle, windows);
        if (windows.isEmpty()) {
            return new double[0];
        }
        double[] normalized = trainer.output(network.network(), features(windows, network.patchLayout()));
        double[] forecasts = new double[normalized.length];
        for (int i = 0; i < normalized.length; i++) {
            double[] stats = instanceStats(windows.get(i).values());
            forecasts[i] = normalized[i] * stats[1] + stats[0];
        }
        return forecasts;
    }

    @Override
    public boolean supportsStreaming() {
        return false;
    }

    @Override
    public byte[] serialize(ModelHandle handle) {
        return trainer.write(trainer.requireNetworkHandle(handle, Architecture.PATCH_TST));
    }

    @Override
    public ModelHandle restore(byte[] artifact) {
        return trainer.read(artifact, Architecture.PATCH_TST);
    }

    // [batch, patchLength, patchCount]
    private INDArray features(List<Window> windows, PatchLayout layout) {
        double[][][] features = new double[windows.size()][layout.patchLength()][layout.patchCount()];
        for (int i = 0; i < windows.size(); i++) {
            double[] values = windows.get(i).values();
            double[] stats = instanceStats(values);
            for (int t = 0; t < values.length; t++) {
                values[t] = (values[t] - stats[0]) / stats[1];
            }
            double[][] patches = layout.segment(values);
            for (int p = 0; p < layout.patchCount(); p++) {
                for (int j = 0; j < layout.patchLength(); j++) {
                    features[i][j][p] = patches[p][j];
                }
            }
        }
        return Nd4j.create(features);
    }

    private static double[] instanceStats(double[] values) {
        double mean = 0.0;
        for (double value : values) {
            mean += value;
        }
        mean /= values.length;
        double variance = 0.0;
        for (double value : values) {
            variance += (value - mean) * (value - mean);
        }
        double std = Math.sqrt(variance / values.length);
        return new double[]{mean, Math.max(std, MIN_STD)};
    }
}
