package com.stockneuro.backend.dto;

import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.forecasting.adapter.HyperparameterSet;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Explicit hyperparameters. Omitted fields fall back to the configured defaults; any request
 * carrying this object is treated as explicit and bypasses the tuner.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HyperparameterRequest {
    @Min(2)
    @Max(500)
    private Integer sequenceLength;
    @Min(1)
    @Max(1024)
    private Integer hiddenUnits;
    @DecimalMin("0.0")
    @DecimalMax(value = "1.0", inclusive = false)
    private Double dropout;
    @Positive
    private Double learningRate;
    @Min(1)
    @Max(1000)
    private Integer epochs;
    @Min(1)
    @Max(4096)
    private Integer batchSize;
    @Min(1)
    @Max(8)
    private Integer layers;
    private Long seed;

    public HyperparameterSet resolve(Architecture architecture, HyperparameterSet defaults) {
        return defaults.toBuilder()
                .architecture(architecture)
                .sequenceLength(sequenceLength != null ? sequenceLength : defaults.sequenceLength())
                .hiddenUnits(hiddenUnits != null ? hiddenUnits : defaults.hiddenUnits())
                .dropout(dropout != null ? dropout : defaults.dropout())
                .learningRate(learningRate != null ? learningRate : defaults.learningRate())
                .epochs(epochs != null ? epochs : defaults.epochs())
                .batchSize(batchSize != null ? batchSize : defaults.batchSize())
                .layers(layers != null ? layers : defaults.layers())
                .seed(seed != null ? seed : defaults.seed())
                .build();
    }
}
