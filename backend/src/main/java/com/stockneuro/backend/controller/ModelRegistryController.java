package com.stockneuro.backend.controller;

import com.stockneuro.backend.dto.ModelVersionResponse;
import com.stockneuro.backend.dto.TrainingRunResponse;
import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.forecasting.brain.TrainingRunLog;
import com.stockneuro.backend.forecasting.registry.ModelRegistryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/models/{architecture}")
@RequiredArgsConstructor
@Tag(name = "Model registry")
public class ModelRegistryController {

    private final ModelRegistryService registry;
    private final TrainingRunLog runLog;

    @GetMapping("/versions")
    @Operation(summary = "List registered versions in version order")
    public ResponseEntity<List<ModelVersionResponse>> versions(@PathVariable Architecture architecture) {
        return ResponseEntity.ok(registry.listVersions(architecture).stream()
                .map(ModelVersionResponse::from)
                .collect(Collectors.toList()));
    }

    @GetMapping("/promoted")
    @Operation(summary = "Get the promoted version")
    public ResponseEntity<ModelVersionResponse> promoted(@PathVariable Architecture architecture) {
        return ResponseEntity.ok(ModelVersionResponse.from(registry.requirePromoted(architecture)));
    }

    @GetMapping("/runs")
    @Operation(summary = "List training runs, oldest first")
    public ResponseEntity<List<TrainingRunResponse>> runs(@PathVariable Architecture architecture) {
        return ResponseEntity.ok(runLog.history(architecture).stream()
                .map(TrainingRunResponse::from)
                .collect(Collectors.toList()));
    }
}
