package com.stockneuro.backend.service;

import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.forecasting.analogue.AnalogueMatch;

import java.time.LocalDate;
import java.util.List;

/**
 * @param intervalsUnavailableReason set when intervals were requested but could not be built
 */
public record ForecastResult(
        String ticker,
        Architecture architecture,
        int versionNumber,
        LocalDate asOf,
        List<ForecastPoint> points,
        Double coverage,
        String intervalsUnavailableReason,
        List<AnalogueMatch> analogues
) {

    public record ForecastPoint(int step, double value, Double lower, Double upper) {
    }
}
