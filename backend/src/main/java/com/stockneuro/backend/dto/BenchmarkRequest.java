package com.stockneuro.backend.dto;

import com.stockneuro.backend.forecasting.adapter.Architecture;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BenchmarkRequest {
    @NotBlank
    @Size(max = 20)
    private String ticker;
    @NotEmpty
    private List<Architecture> architectures;
    @Valid
    private HyperparameterRequest hyperparameters;
}
