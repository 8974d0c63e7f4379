package com.stockneuro.backend.dto;

import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.forecasting.metrics.MetricSnapshot;
import com.stockneuro.backend.model.ModelVersion;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelVersionResponse {
    private Long id;
    private Architecture architecture;
    private int versionNumber;
    private String runId;
    private String ticker;
    private String stage;
    private boolean promoted;
    private String rejectionReason;
    private MetricSnapshot metrics;
    private int sequenceLength;
    private int effectiveLayers;
    private Instant createdAt;
    private Instant promotedAt;
    private Instant supersededAt;
    private Integer supersededByVersion;

    public static ModelVersionResponse from(ModelVersion version) {
        return ModelVersionResponse.builder()
                .id(version.getId())
                .architecture(version.getArchitecture())
                .versionNumber(version.getVersionNumber())
                .runId(version.getRunId())
                .ticker(version.getTicker())
                .stage(version.getStage().name())
                .promoted(version.isPromoted())
                .rejectionReason(version.getRejectionReason())
                .metrics(version.metrics())
                .sequenceLength(version.getSequenceLength())
                .effectiveLayers(version.getEffectiveLayers())
                .createdAt(version.getCreatedAt())
                .promotedAt(version.getPromotedAt())
                .supersededAt(version.getSupersededAt())
                .supersededByVersion(version.getSupersededByVersion())
                .build();
    }
}
