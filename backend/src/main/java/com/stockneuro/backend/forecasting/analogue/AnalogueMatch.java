package com.stockneuro.backend.forecasting.analogue;

import java.time.LocalDate;

public record AnalogueMatch(
        String queryWindowId,
        String segmentId,
        double similarity,
        String ticker,
        LocalDate endDate,
        double realizedReturn
) {
}
