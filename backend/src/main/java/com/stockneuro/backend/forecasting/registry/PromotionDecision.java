package com.stockneuro.backend.forecasting.registry;

public record PromotionDecision(boolean promote, String reason) {

    public static PromotionDecision promote(String reason) {
        return new PromotionDecision(true, reason);
    }

    public static PromotionDecision reject(String reason) {
        return new PromotionDecision(false, reason);
    }
}
