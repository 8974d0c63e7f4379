package com.stockneuro.backend.forecasting.adapter;

import com.stockneuro.backend.config.ForecastingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class LayerDepthPolicy {

    private final ForecastingProperties properties;

    /**
     * Stacked configurations only when the training split is larger than the configured
     * minimum; short series fall back to a single layer.
     */
    public int effectiveDepth(int sampleCount, int requestedDepth) {
        if (requestedDepth <= 1) {
            return 1;
        }
        return sampleCount > properties.getTraining().getMinSamplesForStacked() ? requestedDepth : 1;
    }
}
