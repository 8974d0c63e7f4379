package com.stockneuro.backend.forecasting.adapter;

import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;

public record NetworkModelHandle(
        Architecture architecture,
        MultiLayerNetwork network,
        int inputLength,
        int effectiveLayers,
        PatchLayout patchLayout
) implements ModelHandle {

    public NetworkModelHandle(Architecture architecture, MultiLayerNetwork network, int inputLength, int effectiveLayers) {
        this(architecture, network, inputLength, effectiveLayers, null);
    }
}
