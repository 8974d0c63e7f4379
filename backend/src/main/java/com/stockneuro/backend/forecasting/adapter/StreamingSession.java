package com.stockneuro.backend.forecasting.adapter;

public interface StreamingSession {

    /**
     * Advances the state by one observation and returns the next-step forecast.
     */
    double update(double observation);

    double currentForecast();
}
