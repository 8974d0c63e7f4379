package com.stockneuro.backend.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingRequest {
    @NotBlank
    @Size(max = 20)
    private String ticker;
    private String period;
    @Valid
    private HyperparameterRequest hyperparameters;
}
