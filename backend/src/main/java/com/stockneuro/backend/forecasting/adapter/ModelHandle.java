package com.stockneuro.backend.forecasting.adapter;

/**
 * Trained (or frozen) model produced by {@link ModelAdapter#fit}. Handles are owned by a
 * single run and never shared across concurrent fits.
 */
public interface ModelHandle {

    Architecture architecture();

    int inputLength();

    int effectiveLayers();
}
