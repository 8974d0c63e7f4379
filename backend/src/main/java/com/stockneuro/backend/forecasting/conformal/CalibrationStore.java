package com.stockneuro.backend.forecasting.conformal;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

@Component
public class CalibrationStore {

    private final Map<Long, CalibrationSet> sets = new ConcurrentHashMap<>();

    public Optional<CalibrationSet> find(Long versionId) {
        return Optional.ofNullable(sets.get(versionId));
    }

    public CalibrationSet computeIfAbsent(Long versionId, Function<Long, CalibrationSet> calibrator) {
        return sets.computeIfAbsent(versionId, calibrator);
    }

    public void put(CalibrationSet calibrationSet) {
        sets.put(calibrationSet.versionId(), calibrationSet);
    }

    public void evict(Long versionId) {
        if (versionId != null) {
            sets.remove(versionId);
        }
    }
}
