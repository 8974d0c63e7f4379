package com.stockneuro.backend.model;

import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.forecasting.data.ScaleParams;
import com.stockneuro.backend.forecasting.metrics.MetricSnapshot;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "model_versions",
        uniqueConstraints = @UniqueConstraint(columnNames = {"architecture", "version_number"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelVersion {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Architecture architecture;

    @Column(name = "version_number", nullable = false)
    private int versionNumber;

    @Column(nullable = false, length = 36)
    private String runId;

    @Column(nullable = false, length = 32)
    private String ticker;

    @Column(nullable = false, length = 1024)
    private String artifactRef;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Stage stage;

    @Column(nullable = false)
    private boolean promoted;

    @Column(length = 500)
    private String rejectionReason;

    private Double rmse;
    private Double mae;
    private Double mape;
    private Double smape;
    private Double mase;
    private Double r2;
    private Double toleranceAccuracy;

    @Column(nullable = false)
    private double tolerance;

    private int sampleCount;

    private int sequenceLength;
    private int effectiveLayers;
    private double scaleMin;
    private double scaleMax;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant promotedAt;
    private Instant supersededAt;
    private Integer supersededByVersion;

    public MetricSnapshot metrics() {
        return new MetricSnapshot(rmse, mae, mape, smape, mase, r2, toleranceAccuracy, tolerance, sampleCount);
    }

    public void applyMetrics(MetricSnapshot snapshot) {
        rmse = snapshot.rmse();
        mae = snapshot.mae();
        mape = snapshot.mape();
        smape = snapshot.smape();
        mase = snapshot.mase();
        r2 = snapshot.r2();
        toleranceAccuracy = snapshot.toleranceAccuracy();
        tolerance = snapshot.tolerance();
        sampleCount = snapshot.sampleCount();
    }

    public ScaleParams scaleParams() {
        return new ScaleParams(scaleMin, scaleMax);
    }

    public void transitionTo(Stage target) {
        if (!stage.canTransitionTo(target)) {
            throw new IllegalStateException("Model version " + architecture + " v" + versionNumber
                    + " cannot move from " + stage + " to " + target);
        }
        stage = target;
    }

    public enum Stage {
        CANDIDATE,
        PROMOTED,
        REJECTED;

        boolean canTransitionTo(Stage target) {
            return this == CANDIDATE && (target == PROMOTED || target == REJECTED);
        }
    }
}
