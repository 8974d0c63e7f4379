package com.stockneuro.backend.forecasting.analogue;

import com.stockneuro.backend.config.ForecastingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only index of historical windows searched by feature similarity. Readers work on
 * a snapshot of the copy-on-write list, so a concurrent append is either fully visible or
 * not at all.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnalogueRetriever {

    private final ForecastingProperties properties;

    private final CopyOnWriteArrayList<HistoricalSegment> segments = new CopyOnWriteArrayList<>();
    private final Set<String> indexedIds = ConcurrentHashMap.newKeySet();

    /**
     * Adds every {@code stride}-th window of the series that has a realized next value.
     *
     * @return number of new segments
     */
    public int index(String ticker, List<LocalDate> dates, double[] closes) {
        int length = properties.getAnalogue().getWindowLength();
        int stride = Math.max(1, properties.getAnalogue().getStride());
        if (dates.size() != closes.length) {
            throw new IllegalArgumentException("dates and closes differ in length");
        }
        List<HistoricalSegment> fresh = new ArrayList<>();
        for (int end = length; end < closes.length; end += stride) {
            String id = ticker + "@" + dates.get(end - 1);
            if (!indexedIds.add(id)) {
                continue;
            }
            double[] window = Arrays.copyOfRange(closes, end - length, end);
            double last = window[window.length - 1];
            double outcome = closes[end];
            double realizedReturn = last == 0.0 ? 0.0 : (outcome - last) / last;
            fresh.add(new HistoricalSegment(id, ticker, dates.get(end - 1), window, outcome, realizedReturn,
                    FeatureSummary.of(window)));
        }
        if (!fresh.isEmpty()) {
            segments.addAll(fresh);
            log.debug("Indexed {} segments for {} (index size {})", fresh.size(), ticker, segments.size());
        }
        return fresh.size();
    }

    public List<AnalogueMatch> retrieve(String queryWindowId, double[] queryWindow, int k) {
        List<HistoricalSegment> snapshot = List.copyOf(segments);
        if (snapshot.isEmpty() || k <= 0) {
            return List.of();
        }
        double[] scales = featureSpread(snapshot);
        double[] query = FeatureSummary.of(queryWindow).toArray();
        return snapshot.stream()
                .filter(segment -> !segment.id().equals(queryWindowId))
                .map(segment -> new AnalogueMatch(queryWindowId, segment.id(),
                        similarity(query, segment.features().toArray(), scales),
                        segment.ticker(), segment.endDate(), segment.realizedReturn()))
                .sorted(Comparator.comparingDouble(AnalogueMatch::similarity).reversed())
                .limit(k)
                .collect(Collectors.toList());
    }

    public int size() {
        return segments.size();
    }

    static double similarity(double[] query, double[] candidate, double[] scales) {
        double sum = 0.0;
        for (int i = 0; i < query.length; i++) {
            double d = (query[i] - candidate[i]) / scales[i];
            sum += d * d;
        }
        return 1.0 / (1.0 + Math.sqrt(sum));
    }

    // per-feature standard deviation across the index; 1 where a feature is constant
    private static double[] featureSpread(List<HistoricalSegment> snapshot) {
        double[] mean = new double[FeatureSummary.DIMENSIONS];
        for (HistoricalSegment segment : snapshot) {
            double[] f = segment.features().toArray();
            for (int i = 0; i < f.length; i++) {
                mean[i] += f[i] / snapshot.size();
            }
        }
        double[] spread = new double[FeatureSummary.DIMENSIONS];
        for (HistoricalSegment segment : snapshot) {
            double[] f = segment.features().toArray();
            for (int i = 0; i < f.length; i++) {
                spread[i] += (f[i] - mean[i]) * (f[i] - mean[i]) / snapshot.size();
            }
        }
        for (int i = 0; i < spread.length; i++) {
            spread[i] = spread[i] > 0.0 ? Math.sqrt(spread[i]) : 1.0;
        }
        return spread;
    }
}
