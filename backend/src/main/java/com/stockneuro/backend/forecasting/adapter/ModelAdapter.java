package com.stockneuro.backend.forecasting.adapter;

import com.stockneuro.backend.forecasting.data.Window;

import java.util.List;

/**
 * Uniform contract over forecasting architectures. Implementations are stateless; all
 * learned state lives in the returned {@link ModelHandle}.
 */
public interface ModelAdapter {

    Architecture architecture();

    ModelHandle fit(List<Window> windows, HyperparameterSet hyperparameters, CancellationToken cancellationToken);

    double[] predict(ModelHandle handle, List<Window> windows);

    boolean supportsStreaming();

    byte[] serialize(ModelHandle handle);

    ModelHandle restore(byte[] artifact);

    default StreamingSession openStream(ModelHandle handle, Window seed) {
        throw new UnsupportedOperationException(architecture() + " does not support streaming updates");
    }

    default double predictOne(ModelHandle handle, Window window) {
        return predict(handle, List.of(window))[0];
    }
}
