package com.stockneuro.backend.model;

import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.forecasting.adapter.HyperparameterSet;
import com.stockneuro.backend.forecasting.metrics.MetricSnapshot;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "training_runs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 36)
    private String runId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Architecture architecture;

    @Column(nullable = false, length = 32)
    private String ticker;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status;

    @Column(nullable = false)
    private boolean explicitHyperparameters;

    @Column(nullable = false)
    private int attempt;

    private int sequenceLength;
    private int hiddenUnits;
    private double dropout;
    private double learningRate;
    private int epochs;
    private int batchSize;
    private int layers;
    private long seed;

    private Integer effectiveLayers;

    @Column(nullable = false)
    private Instant startedAt;

    private Instant completedAt;

    private Double rmse;
    private Double mae;
    private Double mape;
    private Double smape;
    private Double mase;
    private Double r2;
    private Double toleranceAccuracy;
    private Double tolerance;
    private Integer sampleCount;

    @Column(length = 2000)
    private String errorMessage;

    private Long modelVersionId;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private ModelVersion.Stage versionStage;

    public HyperparameterSet hyperparameters() {
        return HyperparameterSet.builder()
                .architecture(architecture)
                .sequenceLength(sequenceLength)
                .hiddenUnits(hiddenUnits)
                .dropout(dropout)
                .learningRate(learningRate)
                .epochs(epochs)
                .batchSize(batchSize)
                .layers(layers)
                .seed(seed)
                .build();
    }

    public MetricSnapshot metrics() {
        if (tolerance == null) {
            return null;
        }
        return new MetricSnapshot(rmse, mae, mape, smape, mase, r2, toleranceAccuracy, tolerance,
                sampleCount == null ? 0 : sampleCount);
    }

    public boolean isSealed() {
        return status != Status.RUNNING;
    }

    public static TrainingRun open(String runId, String ticker, HyperparameterSet hyperparameters,
                                   boolean explicit, int attempt, Instant startedAt) {
        return TrainingRun.builder()
                .runId(runId)
                .architecture(hyperparameters.architecture())
                .ticker(ticker)
                .status(Status.RUNNING)
                .explicitHyperparameters(explicit)
                .attempt(attempt)
                .sequenceLength(hyperparameters.sequenceLength())
                .hiddenUnits(hyperparameters.hiddenUnits())
                .dropout(hyperparameters.dropout())
                .learningRate(hyperparameters.learningRate())
                .epochs(hyperparameters.epochs())
                .batchSize(hyperparameters.batchSize())
                .layers(hyperparameters.layers())
                .seed(hyperparameters.seed())
                .startedAt(startedAt)
                .build();
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

    public enum Status {
        RUNNING,
        COMPLETED,
        FAILED,
        DIVERGED,
        CANCELLED
    }
}
