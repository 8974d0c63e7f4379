package com.stockneuro.backend.service;

import com.stockneuro.backend.forecasting.adapter.Architecture;
import com.stockneuro.backend.model.TrainingRun;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
@RequiredArgsConstructor
public class ForecastMetricsService {

    private final MeterRegistry meterRegistry;

    public void recordRun(Architecture architecture, TrainingRun.Status status, Duration duration) {
        Counter.builder("training_runs_total")
                .tag("architecture", architecture.name())
                .tag("status", status.name())
                .register(meterRegistry)
                .increment();
        Timer.builder("training_duration")
                .tag("architecture", architecture.name())
                .register(meterRegistry)
                .record(duration);
    }

    public void recordPromotion(Architecture architecture, boolean promoted) {
        Counter.builder("model_registrations_total")
                .tag("architecture", architecture.name())
                .tag("outcome", promoted ? "promoted" : "rejected")
                .register(meterRegistry)
                .increment();
    }

    public void recordForecast(Architecture architecture) {
        Counter.builder("forecasts_served_total")
                .tag("architecture", architecture.name())
                .register(meterRegistry)
                .increment();
    }
}
