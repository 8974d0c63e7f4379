package com.stockneuro.backend.util;

import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.model.ModelVersion;
import com.stockneuro.backend.repository.ModelVersionRepository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Mocked {@link ModelVersionRepository} backed by a list, for registry tests that run without a database.
 */
public final class InMemoryModelVersions {

    private InMemoryModelVersions() {}

    public static ModelVersionRepository repository() {
        List<ModelVersion> rows = new ArrayList<>();
        AtomicLong ids = new AtomicLong();
        ModelVersionRepository repository = mock(ModelVersionRepository.class);
        when(repository.save(any(ModelVersion.class))).thenAnswer(invocation -> {
            ModelVersion version = invocation.getArgument(0);
            synchronized (rows) {
                if (version.getId() == null) {
                    version.setId(ids.incrementAndGet());
                    rows.add(version);
                }
            }
            return version;
        });
        when(repository.findByArchitectureOrderByVersionNumberAsc(any(Architecture.class))).thenAnswer(invocation -> {
            Architecture architecture = invocation.getArgument(0);
            synchronized (rows) {
                return rows.stream()
                        .filter(row -> row.getArchitecture() == architecture)
                        .sorted(Comparator.comparingInt(ModelVersion::getVersionNumber))
                        .collect(Collectors.toList());
            }
        });
        when(repository.findByArchitectureAndPromotedTrue(any(Architecture.class))).thenAnswer(invocation -> {
            Architecture architecture = invocation.getArgument(0);
            synchronized (rows) {
                return rows.stream()
                        .filter(row -> row.getArchitecture() == architecture && row.isPromoted())
                        .collect(Collectors.toList());
            }
        });
        when(repository.findTopByArchitectureOrderByVersionNumberDesc(any(Architecture.class))).thenAnswer(invocation -> {
            Architecture architecture = invocation.getArgument(0);
            synchronized (rows) {
                Optional<ModelVersion> latest = rows.stream()
                        .filter(row -> row.getArchitecture() == architecture)
                        .max(Comparator.comparingInt(ModelVersion::getVersionNumber));
                return latest;
            }
        });
        return repository;
    }
}
