package com.stockneuro.backend.dto;

import com.stockneuro.backend.forecasting.adapter.Architecture;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingJobRequest {
    @NotNull
    private Architecture architecture;
    @NotBlank
    @Size(max = 20)
    private String ticker;
    private String period;
    @Valid
    private HyperparameterRequest hyperparameters;
}
