package com.stockneuro.backend.repository;

import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.model.ModelVersion;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ModelVersionRepository extends JpaRepository<ModelVersion, Long> {
    List<ModelVersion> findByArchitectureOrderByVersionNumberAsc(Architecture architecture);

    List<ModelVersion> findByArchitectureAndPromotedTrue(Architecture architecture);

    Optional<ModelVersion> findTopByArchitectureOrderByVersionNumberDesc(Architecture architecture);
}
