package com.stockneuro.backend.dto;

import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.forecasting.adapter.HyperparameterSet;
import com.stockneuro.backend.forecasting.metrics.MetricSnapshot;
import com.stockneuro.backend.model.TrainingRun;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingRunResponse {
    private String runId;
    private Architecture architecture;
    private String ticker;
    private String status;
    private int attempt;
    private boolean explicitHyperparameters;
    private HyperparameterSet hyperparameters;
    private Integer effectiveLayers;
    private MetricSnapshot metrics;
    private Long modelVersionId;
    private String versionStage;
    private String errorMessage;
    private Instant startedAt;
    private Instant completedAt;

    public static TrainingRunResponse from(TrainingRun run) {
        return TrainingRunResponse.builder()
                .runId(run.getRunId())
                .architecture(run.getArchitecture())
                .ticker(run.getTicker())
                .status(run.getStatus().name())
                .attempt(run.getAttempt())
                .explicitHyperparameters(run.isExplicitHyperparameters())
                .hyperparameters(run.hyperparameters())
                .effectiveLayers(run.getEffectiveLayers())
                .metrics(run.metrics())
                .modelVersionId(run.getModelVersionId())
                .versionStage(run.getVersionStage() != null ? run.getVersionStage().name() : null)
                .errorMessage(run.getErrorMessage())
                .startedAt(run.getStartedAt())
                .completedAt(run.getCompletedAt())
                .build();
    }
}
