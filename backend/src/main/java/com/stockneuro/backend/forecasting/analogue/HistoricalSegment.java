package com.stockneuro.backend.forecasting.analogue;

import java.time.LocalDate;

/**
 * @param realizedReturn relative move from the last window price to the next observed price
 */
public record HistoricalSegment(
        String id,
        String ticker,
        LocalDate endDate,
        double[] window,
        double realizedOutcome,
        double realizedReturn,
        FeatureSummary features
) {

    public HistoricalSegment {
        window = window.clone();
    }

    @Override
    public double[] window() {
        return window.clone();
    }
}
