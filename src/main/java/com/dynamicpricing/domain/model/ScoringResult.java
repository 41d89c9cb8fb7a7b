package com.dynamicpricing.domain.model;

/**
 * Output of a pricing model call. {@code fallback} is true when the model failed
 * and the deterministic fallback formula produced the multiplier instead.
 */
public record ScoringResult(double priceMultiplier, String explanation, boolean fallback) {

    public static ScoringResult scored(double priceMultiplier, String explanation) {
        return new ScoringResult(priceMultiplier, explanation, false);
    }

    public static ScoringResult fallback(double priceMultiplier, String explanation) {
        return new ScoringResult(priceMultiplier, explanation, true);
    }
}
