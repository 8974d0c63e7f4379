package com.stockneuro.backend.forecasting.benchmark;

import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.forecasting.metrics.MetricSnapshot;

import java.util.List;
import java.util.Map;

/**
 * One row of the comparison table.
 *
 * @param peakHeapBytes JVM heap high-water mark across fit and predict
 * @param offHeapBytes native memory JavaCPP tracks for ND4J buffers once predict returns
 * @param reproducible whether the tolerance-accuracy spread stays within the configured tolerance
 */
public record ArchitectureBenchmark(
        Architecture architecture,
        List<MetricSnapshot> runs,
        Map<String, MetricStat> metrics,
        MetricStat trainingMillis,
        MetricStat inferenceMicrosPerWindow,
        MetricStat peakHeapBytes,
        MetricStat offHeapBytes,
        MetricStat intervalCoverage,
        boolean reproducible,
        String error
) {
}
