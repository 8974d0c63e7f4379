package com.stockneuro.backend.forecasting.adapter;

import com.stockneuro.backend.exception.TrainingCancelledException;

public class CancellationToken {

    private volatile boolean cancelled;

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || Thread.currentThread().isInterrupted();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new TrainingCancelledException("Training cancelled");
        }
    }
}
