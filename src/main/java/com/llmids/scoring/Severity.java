package com.llmids.scoring;

import java.util.Locale;
import java.util.Optional;

/**
 * Severity names in ascending rank.
 */
public enum Severity {
    NONE,
    LOW,
    MED,
    HIGH,
    CRITICAL;

    public static Optional<Severity> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("MEDIUM".equals(normalized)) {
            return Optional.of(MED);
        }
        try {
            return Optional.of(Severity.valueOf(normalized));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public boolean atLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
