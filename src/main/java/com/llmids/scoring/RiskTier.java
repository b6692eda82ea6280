package com.llmids.scoring;

/**
 * Coarse confidence-derived label, independent of the configured severity bands.
 */
public enum RiskTier {
    NONE,
    LOW,
    ELEVATED,
    HIGH,
    CRITICAL;

    public static RiskTier fromConfidence(double confidence) {
        if (confidence >= 0.85) {
            return CRITICAL;
        }
        if (confidence >= 0.65) {
            return HIGH;
        }
        if (confidence >= 0.40) {
            return ELEVATED;
        }
        if (confidence > 0.0) {
            return LOW;
        }
        return NONE;
    }
}
