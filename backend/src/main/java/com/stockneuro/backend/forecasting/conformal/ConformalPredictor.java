package com.stockneuro.backend.forecasting.conformal;

import com.stockneuro.backend.config.ForecastingProperties;
import com.stockneuro.backend.exception.CalibrationInsufficientException;
import com.stockneuro.backend.forecasting.adapter.ModelAdapter;
import com.stockneuro.backend.forecasting.adapter.ModelHandle;
import com.stockneuro.backend.forecasting.data.PreparedDataset;
import com.stockneuro.backend.forecasting.data.Window;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Split-conformal intervals from held-out residuals, with an adaptive variant that
 * nudges the miscoverage level after every realized outcome.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConformalPredictor {

    private final ForecastingProperties properties;

    public CalibrationSet calibrate(Long versionId, ModelAdapter adapter, ModelHandle handle, List<Window> heldOut) {
        double[] predicted = adapter.predict(handle, heldOut);
        return calibrate(versionId, PreparedDataset.targets(heldOut), predicted);
    }

    public CalibrationSet calibrate(Long versionId, double[] actual, double[] predicted) {
        if (actual.length != predicted.length) {
            throw new IllegalArgumentException("actual and predicted differ in length");
        }
        double[] residuals = new double[actual.length];
        for (int i = 0; i < actual.length; i++) {
            residuals[i] = actual[i] - predicted[i];
        }
        log.debug("Calibrated version {} on {} residuals", versionId, residuals.length);
        return new CalibrationSet(versionId, residuals, properties.getConformal().getAdaptationRate());
    }

    public PredictionInterval interval(double pointForecast, CalibrationSet calibrationSet, double targetCoverage) {
        requireCoverage(targetCoverage);
        return intervalAtLevel(pointForecast, calibrationSet, targetCoverage);
    }

    /**
     * Interval at the adaptively tracked level. The set remembers it so the next
     * {@link #observe} call can score it.
     */
    public PredictionInterval adaptiveInterval(double pointForecast, CalibrationSet calibrationSet, double targetCoverage) {
        requireCoverage(targetCoverage);
        synchronized (calibrationSet) {
            double level = calibrationSet.adaptiveLevel(targetCoverage);
            PredictionInterval interval = intervalAtLevel(pointForecast, calibrationSet, level);
            calibrationSet.remember(interval);
            return interval;
        }
    }

    public boolean observe(CalibrationSet calibrationSet, double outcome) {
        return calibrationSet.observe(outcome);
    }

    double quantile(CalibrationSet calibrationSet, double level) {
        double[] sorted = calibrationSet.sortedMagnitudes();
        int n = sorted.length;
        double rank = Math.ceil((n + 1) * level);
        if (rank > n) {
            return Double.POSITIVE_INFINITY;
        }
        if (rank < 1) {
            return 0.0;
        }
        return sorted[(int) rank - 1];
    }

    private PredictionInterval intervalAtLevel(double pointForecast, CalibrationSet calibrationSet, double level) {
        int minimum = properties.getConformal().getMinCalibrationSize();
        if (calibrationSet.size() < minimum) {
            throw new CalibrationInsufficientException("Calibration set has " + calibrationSet.size()
                    + " residuals, at least " + minimum + " are required");
        }
        double halfWidth = quantile(calibrationSet, level);
        return new PredictionInterval(pointForecast - halfWidth, pointForecast + halfWidth, level);
    }

    private static void requireCoverage(double targetCoverage) {
        if (!(targetCoverage > 0.0 && targetCoverage < 1.0)) {
            throw new IllegalArgumentException("Target coverage must be in (0, 1), got " + targetCoverage);
        }
    }
}
