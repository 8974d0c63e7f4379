package com.stockneuro.backend.forecasting.registry;

import com.stockneuro.backend.model.ModelVersion;

/**
 * @param superseded the version that stopped serving, or null
 */
public record RegistrationResult(ModelVersion version, ModelVersion superseded, PromotionDecision decision) {

    public boolean promoted() {
        return decision.promote();
    }
}
