package com.stockneuro.backend.forecasting.metrics;

import org.springframework.stereotype.Component;

@Component
public class MetricsEngine {

    static final double EPSILON = 1e-8;

    public MetricSnapshot evaluate(double[] actual, double[] predicted, double tolerance) {
        if (actual.length != predicted.length) {
            throw new IllegalArgumentException("actual and predicted differ in length: "
                    + actual.length + " vs " + predicted.length);
        }
        if (!(tolerance >= 0.0) || Double.isInfinite(tolerance)) {
            throw new IllegalArgumentException("Tolerance must be a finite non-negative number");
        }
        int n = actual.length;
        if (n == 0) {
            return new MetricSnapshot(null, null, null, null, null, null, null, tolerance, 0);
        }

        double squared = 0.0;
        double absolute = 0.0;
        double apeSum = 0.0;
        int apeTerms = 0;
        double sapeSum = 0.0;
        int sapeTerms = 0;
        for (int i = 0; i < n; i++) {
            double error = actual[i] - predicted[i];
            squared += error * error;
            absolute += Math.abs(error);
            if (Math.abs(actual[i]) > EPSILON) {
                apeSum += Math.abs(error / actual[i]);
                apeTerms++;
            }
            double denominator = (Math.abs(actual[i]) + Math.abs(predicted[i])) / 2.0;
            if (denominator > EPSILON) {
                sapeSum += Math.abs(error) / denominator;
                sapeTerms++;
            }
        }
        double mae = absolute / n;
        return new MetricSnapshot(
                finiteOrNull(Math.sqrt(squared / n)),
                finiteOrNull(mae),
                apeTerms == 0 ? null : finiteOrNull(apeSum / apeTerms * 100.0),
                sapeTerms == 0 ? null : finiteOrNull(sapeSum / sapeTerms * 100.0),
                mase(actual, mae),
                r2(actual, squared),
                toleranceAccuracy(actual, predicted, tolerance),
                tolerance,
                n
        );
    }

    public double toleranceAccuracy(double[] actual, double[] predicted, double tolerance) {
        int within = 0;
        for (int i = 0; i < actual.length; i++) {
            double p = predicted[i];
            if (!Double.isFinite(p) || !Double.isFinite(actual[i])) {
                continue;
            }
            double error = Math.abs(actual[i] - p);
            if (Math.abs(actual[i]) <= EPSILON) {
                if (error <= EPSILON) {
                    within++;
                }
            } else if (error / Math.abs(actual[i]) <= tolerance) {
                within++;
            }
        }
        return actual.length == 0 ? 0.0 : within * 100.0 / actual.length;
    }

    private Double mase(double[] actual, double mae) {
        if (actual.length < 2) {
            return null;
        }
        double naive = 0.0;
        for (int i = 1; i < actual.length; i++) {
            naive += Math.abs(actual[i] - actual[i - 1]);
        }
        naive /= (actual.length - 1);
        if (naive <= 0.0 || !Double.isFinite(naive)) {
            return null;
        }
        return finiteOrNull(mae / naive);
    }

    private Double r2(double[] actual, double residualSquares) {
        double mean = 0.0;
        for (double value : actual) {
            mean += value;
        }
        mean /= actual.length;
        double total = 0.0;
        for (double value : actual) {
            total += (value - mean) * (value - mean);
        }
        if (total <= 0.0) {
            return null;
        }
        return finiteOrNull(1.0 - residualSquares / total);
    }

    private static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }
}
