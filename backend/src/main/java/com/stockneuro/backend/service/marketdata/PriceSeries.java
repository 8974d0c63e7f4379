package com.stockneuro.backend.service.marketdata;

import java.time.LocalDate;
import java.util.List;

/**
 * Daily closes in chronological order.
 */
public record PriceSeries(String ticker, List<LocalDate> dates, double[] closes) {

    public PriceSeries {
        if (dates.size() != closes.length) {
            throw new IllegalArgumentException("dates and closes differ in length");
        }
        dates = List.copyOf(dates);
        closes = closes.clone();
    }

    @Override
    public double[] closes() {
        return closes.clone();
    }

    public int size() {
        return closes.length;
    }

    public LocalDate lastDate() {
        return dates.isEmpty() ? null : dates.get(dates.size() - 1);
    }
}
