package com.stockneuro.backend.forecasting.adapter;

import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;

/**
 * Frozen pretrained model. {@code network} is null when the built-in trend kernel is used.
 */
public record ZeroShotHandle(int inputLength, int trendLookback, MultiLayerNetwork network) implements ModelHandle {

    @Override
    public Architecture architecture() {
        return Architecture.ZERO_SHOT;
    }

    @Override
    public int effectiveLayers() {
        return network == null ? 0 : network.getnLayers();
    }

    public boolean usesPretrainedNetwork() {
        return network != null;
    }
}
