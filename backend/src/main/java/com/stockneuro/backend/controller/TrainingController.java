package com.stockneuro.backend.controller;

import com.stockneuro.backend.dto.HyperparameterRequest;
import com.stockneuro.backend.dto.TrainingJobRequest;
import com.stockneuro.backend.dto.TrainingJobResponse;
import com.stockneuro.backend.dto.TrainingRequest;
import com.stockneuro.backend.dto.TrainingRunResponse;
import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.forecasting.adapter.CancellationToken;
import com.stockneuro.backend.forecasting.adapter.HyperparameterSet;
import com.stockneuro.backend.forecasting.brain.AutoLearningBrain;
import com.stockneuro.backend.service.ForecastPipelineService;
import com.stockneuro.backend.service.TrainingJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Training")
public class TrainingController {

    private final ForecastPipelineService pipelineService;
    private final TrainingJobService trainingJobService;
    private final AutoLearningBrain brain;

    @PostMapping("/models/{architecture}/train")
    @Operation(summary = "Train and evaluate one model synchronously")
    @ApiResponse(responseCode = "200")
    public ResponseEntity<TrainingRunResponse> train(@PathVariable Architecture architecture,
                                                     @Valid @RequestBody TrainingRequest request) {
        HyperparameterSet hyperparameters = resolve(architecture, request.getHyperparameters());
        return ResponseEntity.ok(TrainingRunResponse.from(pipelineService.trainAndEvaluate(
                request.getTicker(), architecture, hyperparameters, request.getPeriod(), CancellationToken.none())));
    }

    @PostMapping("/training-jobs")
    @Operation(summary = "Queue a training run on the training pool")
    @ApiResponse(responseCode = "202")
    public ResponseEntity<TrainingJobResponse> submit(@Valid @RequestBody TrainingJobRequest request) {
        HyperparameterSet hyperparameters = resolve(request.getArchitecture(), request.getHyperparameters());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(TrainingJobResponse.from(trainingJobService.submit(
                request.getTicker(), request.getArchitecture(), hyperparameters, request.getPeriod())));
    }

    @GetMapping("/training-jobs/{jobId}")
    @Operation(summary = "Get training job status")
    public ResponseEntity<TrainingJobResponse> job(@PathVariable String jobId) {
        return ResponseEntity.ok(TrainingJobResponse.from(trainingJobService.get(jobId)));
    }

    @PostMapping("/training-jobs/{jobId}/cancel")
    @Operation(summary = "Cancel a queued or running training job")
    public ResponseEntity<TrainingJobResponse> cancel(@PathVariable String jobId) {
        return ResponseEntity.ok(TrainingJobResponse.from(trainingJobService.cancel(jobId)));
    }

    private HyperparameterSet resolve(Architecture architecture, HyperparameterRequest request) {
        return request == null ? null : request.resolve(architecture, brain.defaults(architecture));
    }
}
