package com.stockneuro.backend.forecasting.registry;

import com.stockneuro.backend.forecasting.adapter.Architecture;

public interface ArtifactStore {

    /**
     * Persists a serialized model and returns a reference that {@link #load} accepts.
     */
    String store(Architecture architecture, int versionNumber, String runId, byte[] artifact);

    byte[] load(String artifactRef);
}
