package com.stockneuro.backend.repository;

import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.model.TrainingRun;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface TrainingRunRepository extends JpaRepository<TrainingRun, Long> {
    Optional<TrainingRun> findByRunId(String runId);

    List<TrainingRun> findByArchitectureOrderByStartedAtAsc(Architecture architecture);

    List<TrainingRun> findByArchitectureAndStatusOrderByStartedAtAsc(Architecture architecture, TrainingRun.Status status);
}
