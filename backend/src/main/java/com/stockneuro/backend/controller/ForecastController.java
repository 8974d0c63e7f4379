package com.stockneuro.backend.controller;

import com.stockneuro.backend.dto.ObservationRequest;
import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.service.ForecastResult;
import com.stockneuro.backend.service.ForecastService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
@RequestMapping("/api/forecast")
@RequiredArgsConstructor
@Tag(name = "Forecast")
public class ForecastController {

    private final ForecastService forecastService;

    @GetMapping
    @Operation(summary = "Forecast the next closes with the promoted model")
    public ResponseEntity<ForecastResult> forecast(@RequestParam @NotBlank String ticker,
                                                   @RequestParam(defaultValue = "LSTM") Architecture architecture,
                                                   @RequestParam(defaultValue = "1") @Min(1) @Max(365) int horizon,
                                                   @RequestParam(required = false)
                                                   @DecimalMin(value = "0.0", inclusive = false)
                                                   @DecimalMax(value = "1.0", inclusive = false) Double coverage) {
        return ResponseEntity.ok(forecastService.getForecast(ticker, architecture, horizon, coverage));
    }

    @PostMapping("/{architecture}/observations")
    @Operation(summary = "Report the realized close for the last issued one-step interval")
    public ResponseEntity<ForecastService.ObservationResult> observe(@PathVariable Architecture architecture,
                                                                     @Valid @RequestBody ObservationRequest request) {
        return ResponseEntity.ok(forecastService.observe(request.getTicker(), architecture, request.getActual()));
    }
}
