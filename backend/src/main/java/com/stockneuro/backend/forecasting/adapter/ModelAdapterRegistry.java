package com.stockneuro.backend.forecasting.adapter;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class ModelAdapterRegistry {

    private final Map<Architecture, ModelAdapter> adapters = new EnumMap<>(Architecture.class);

    public ModelAdapterRegistry(List<ModelAdapter> adapters) {
        for (ModelAdapter adapter : adapters) {
            ModelAdapter previous = this.adapters.put(adapter.architecture(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate adapters for " + adapter.architecture());
            }
        }
    }

    public ModelAdapter get(Architecture architecture) {
        ModelAdapter adapter = adapters.get(architecture);
        if (adapter == null) {
            throw new IllegalArgumentException("No adapter registered for " + architecture);
        }
        return adapter;
    }

    public Set<Architecture> architectures() {
        return Collections.unmodifiableSet(adapters.keySet());
    }
}
