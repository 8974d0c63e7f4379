package com.stockneuro.backend.dto;

import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.service.TrainingJobService.TrainingJob;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingJobResponse {
    private String jobId;
    private Architecture architecture;
    private String ticker;
    private String state;
    private Instant submittedAt;
    private Instant completedAt;
    private String errorMessage;
    private TrainingRunResponse run;

    public static TrainingJobResponse from(TrainingJob job) {
        return TrainingJobResponse.builder()
                .jobId(job.getJobId())
                .architecture(job.getArchitecture())
                .ticker(job.getTicker())
                .state(job.getState().name())
                .submittedAt(job.getSubmittedAt())
                .completedAt(job.getCompletedAt())
                .errorMessage(job.getErrorMessage())
                .run(job.getRun() != null ? TrainingRunResponse.from(job.getRun()) : null)
                .build();
    }
}
