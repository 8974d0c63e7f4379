package com.stockneuro.backend.forecasting.adapter;

import org.deeplearning4j.nn.conf.GradientNormalization;
import org.deeplearning4j.nn.conf.NeuralNetConfiguration;
import org.deeplearning4j.nn.conf.inputs.InputType;
import org.deeplearning4j.nn.conf.layers.DropoutLayer;
import org.deeplearning4j.nn.conf.layers.Layer;
import org.deeplearning4j.nn.conf.layers.OutputLayer;
import org.deeplearning4j.nn.conf.layers.recurrent.LastTimeStep;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.deeplearning4j.nn.weights.WeightInit;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.learning.config.Adam;
import org.nd4j.linalg.lossfunctions.LossFunctions;

import java.util.function.Supplier;

final class RecurrentNetworks {

    private RecurrentNetworks() {
    }

    static NeuralNetConfiguration.ListBuilder baseConfiguration(HyperparameterSet hyperparameters) {
        return new NeuralNetConfiguration.Builder()
                .seed(hyperparameters.seed())
                .dataType(DataType.DOUBLE)
                .weightInit(WeightInit.XAVIER)
                .updater(new Adam(hyperparameters.learningRate()))
                .gradientNormalization(GradientNormalization.ClipElementWiseAbsoluteValue)
                .gradientNormalizationThreshold(1.0)
                .list();
    }

    /**
     * Stacks {@code depth} recurrent layers, keeps only the last time step of the top one
     * and regresses a single value from it.
     */
    static MultiLayerNetwork stacked(HyperparameterSet hyperparameters, int depth, int inputLength,
                                     Supplier<Layer> recurrentLayer) {
        NeuralNetConfiguration.ListBuilder list = baseConfiguration(hyperparameters);
        for (int i = 0; i < depth; i++) {
            Layer layer = recurrentLayer.get();
            list.layer(i == depth - 1 ? new LastTimeStep(layer) : layer);
            if (hyperparameters.dropout() > 0.0) {
                list.layer(new DropoutLayer.Builder().dropOut(1.0 - hyperparameters.dropout()).build());
            }
        }
        list.layer(new OutputLayer.Builder(LossFunctions.LossFunction.MSE)
                .nOut(1)
                .activation(Activation.IDENTITY)
                .build());
        list.setInputType(InputType.recurrent(1, inputLength));
        MultiLayerNetwork network = new MultiLayerNetwork(list.build());
        network.init();
        return network;
    }
}
