package com.stockneuro.backend.forecasting.benchmark;

/**
 * Half-open window index ranges of one walk-forward fold.
 */
public record WalkForwardSplit(int splitNumber, int trainStart, int trainEnd, int testStart, int testEnd) {

    public int trainWindows() {
        return trainEnd - trainStart;
    }

    public int testWindows() {
        return testEnd - testStart;
    }
}
