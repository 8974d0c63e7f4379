package com.stockneuro.backend.dto;

import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.forecasting.benchmark.WalkForwardPlan;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Unset plan fields fall back to the configured walk-forward defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WalkForwardRequest {
    @NotBlank
    @Size(max = 20)
    private String ticker;
    @NotNull
    private Architecture architecture;
    private WalkForwardPlan.Strategy strategy;
    @Positive
    private Integer trainSize;
    @Positive
    private Integer testSize;
    @Positive
    private Integer stepSize;
    @Valid
    private HyperparameterRequest hyperparameters;

    public WalkForwardPlan resolvePlan(WalkForwardPlan defaults) {
        return new WalkForwardPlan(
                strategy != null ? strategy : defaults.strategy(),
                trainSize != null ? trainSize : defaults.trainSize(),
                testSize != null ? testSize : defaults.testSize(),
                stepSize != null ? stepSize : defaults.stepSize());
    }
}
