package com.stockneuro.backend.forecasting.conformal;

import java.util.Arrays;

/**
 * Held-out residuals of one model version together with the adaptive coverage state
 * that {@link ConformalPredictor#observe} updates.
 */
public class CalibrationSet {

    static final double MIN_ALPHA = -0.5;
    static final double MAX_ALPHA = 1.5;

    private final Long versionId;
    private final double[] residuals;
    private final double[] sortedMagnitudes;
    private final double adaptationRate;

    private Double trackedCoverage;
    private double alpha;
    private PredictionInterval lastInterval;
    private long observations;
    private long misses;

    CalibrationSet(Long versionId, double[] residuals, double adaptationRate) {
        this.versionId = versionId;
        this.residuals = residuals.clone();
        this.sortedMagnitudes = new double[residuals.length];
        for (int i = 0; i < residuals.length; i++) {
            double magnitude = Math.abs(residuals[i]);
            sortedMagnitudes[i] = Double.isNaN(magnitude) ? Double.POSITIVE_INFINITY : magnitude;
        }
        Arrays.sort(sortedMagnitudes);
        this.adaptationRate = adaptationRate;
    }

    public Long versionId() {
        return versionId;
    }

    public int size() {
        return residuals.length;
    }

    public double[] residuals() {
        return residuals.clone();
    }

    double[] sortedMagnitudes() {
        return sortedMagnitudes;
    }

    public double adaptationRate() {
        return adaptationRate;
    }

    public synchronized double effectiveAlpha() {
        return alpha;
    }

    public synchronized Double trackedCoverage() {
        return trackedCoverage;
    }

    public synchronized PredictionInterval lastInterval() {
        return lastInterval;
    }

    public synchronized long observations() {
        return observations;
    }

    public synchronized long misses() {
        return misses;
    }

    public synchronized double empiricalCoverage() {
        return observations == 0 ? Double.NaN : 1.0 - (double) misses / observations;
    }

    /**
     * Quantile level for the next adaptive interval. Switching the target coverage
     * restarts tracking from the new target.
     */
    synchronized double adaptiveLevel(double targetCoverage) {
        if (trackedCoverage == null || Double.compare(trackedCoverage, targetCoverage) != 0) {
            trackedCoverage = targetCoverage;
            alpha = 1.0 - targetCoverage;
            observations = 0;
            misses = 0;
            lastInterval = null;
        }
        return 1.0 - alpha;
    }

    synchronized void remember(PredictionInterval interval) {
        lastInterval = interval;
    }

    synchronized boolean observe(double outcome) {
        if (lastInterval == null || trackedCoverage == null) {
            throw new IllegalStateException("No adaptive interval has been issued for version " + versionId);
        }
        boolean covered = lastInterval.contains(outcome);
        double miss = covered ? 0.0 : 1.0;
        double target = 1.0 - trackedCoverage;
        alpha = Math.max(MIN_ALPHA, Math.min(MAX_ALPHA, alpha + adaptationRate * (target - miss)));
        observations++;
        if (!covered) {
            misses++;
        }
        return covered;
    }
}
