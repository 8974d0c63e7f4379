package com.stockneuro.backend.forecasting.adapter;

import com.stockneuro.backend.config.ForecastingProperties;
import com.stockneuro.backend.exception.ArtifactStorageException;
import com.stockneuro.backend.forecasting.data.Window;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.deeplearning4j.util.ModelSerializer;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Pretrained forecaster that is never trained here. With no weights configured it
 * extrapolates a least-squares line through the most recent points of each window.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ZeroShotAdapter implements ModelAdapter {

    private final NetworkTrainer trainer;
    private final ForecastingProperties properties;

    private volatile MultiLayerNetwork pretrained;

    @Override
    public Architecture architecture() {
        return Architecture.ZERO_SHOT;
    }

    @Override
    public ModelHandle fit(List<Window> windows, HyperparameterSet hyperparameters, CancellationToken cancellationToken) {
        cancellationToken.throwIfCancelled();
        int lookback = properties.getModels().getZeroShot().getTrendLookback();
        return new ZeroShotHandle(hyperparameters.sequenceLength(), lookback, loadPretrained());
    }

    @Override
    public double[] predict(ModelHandle handle, List<Window> windows) {
        ZeroShotHandle zeroShot = requireHandle(handle);
        trainer.requireInputLength(handle, windows);
        if (windows.isEmpty()) {
            return new double[0];
        }
        if (zeroShot.usesPretrainedNetwork()) {
            return trainer.output(zeroShot.network(), trainer.recurrentFeatures(windows));
        }
        double[] forecasts = new double[windows.size()];
        for (int i = 0; i < windows.size(); i++) {
            forecasts[i] = extrapolateTrend(windows.get(i).values(), zeroShot.trendLookback());
        }
        return forecasts;
    }

    @Override
    public boolean supportsStreaming() {
        return false;
    }

    @Override
    public byte[] serialize(ModelHandle handle) {
        ZeroShotHandle zeroShot = requireHandle(handle);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeInt(zeroShot.inputLength());
            out.writeInt(zeroShot.trendLookback());
            out.writeBoolean(zeroShot.usesPretrainedNetwork());
            if (zeroShot.usesPretrainedNetwork()) {
                ModelSerializer.writeModel(zeroShot.network(), out, false);
            }
        } catch (IOException ex) {
            throw new ArtifactStorageException("Failed to serialize zero-shot model", ex);
        }
        return bytes.toByteArray();
    }

    @Override
    public ModelHandle restore(byte[] artifact) {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(artifact))) {
            int inputLength = in.readInt();
            int lookback = in.readInt();
            MultiLayerNetwork network = in.readBoolean() ? ModelSerializer.restoreMultiLayerNetwork(in, false) : null;
            return new ZeroShotHandle(inputLength, lookback, network);
        } catch (IOException ex) {
            throw new ArtifactStorageException("Failed to restore zero-shot model", ex);
        }
    }

    static double extrapolateTrend(double[] values, int lookback) {
        int n = Math.max(2, Math.min(lookback, values.length));
        int offset = values.length - n;
        double meanX = (n - 1) / 2.0;
        double meanY = 0.0;
        for (int i = 0; i < n; i++) {
            meanY += values[offset + i];
        }
        meanY /= n;
        double covariance = 0.0;
        double varianceX = 0.0;
        for (int i = 0; i < n; i++) {
            covariance += (i - meanX) * (values[offset + i] - meanY);
            varianceX += (i - meanX) * (i - meanX);
        }
        double slope = covariance / varianceX;
        return meanY + slope * (n - meanX);
    }

    private MultiLayerNetwork loadPretrained() {
        String path = properties.getModels().getZeroShot().getWeightsPath();
        if (path == null || path.isBlank()) {
            return null;
        }
        if (pretrained == null) {
            synchronized (this) {
                if (pretrained == null) {
                    try {
                        pretrained = ModelSerializer.restoreMultiLayerNetwork(new File(path), false);
                        log.info("Loaded pretrained zero-shot weights from {}", path);
                    } catch (IOException ex) {
                        throw new ArtifactStorageException("Failed to load pretrained weights from " + path, ex);
                    }
                }
            }
        }
        return pretrained.clone();
    }

    private ZeroShotHandle requireHandle(ModelHandle handle) {
        if (!(handle instanceof ZeroShotHandle zeroShot)) {
            throw new IllegalArgumentException("Expected a zero-shot handle but got "
                    + (handle == null ? "null" : handle.architecture()));
        }
        return zeroShot;
    }
}
