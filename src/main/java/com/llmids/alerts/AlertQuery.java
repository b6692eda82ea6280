package com.llmids.alerts;

import java.time.Instant;
import java.util.Objects;

import com.llmids.scoring.Severity;

/**
 * Filter for active-alert lookups: creation cutoff first, then score, label and severity.
 * Null filters match everything.
 */
public record AlertQuery(Instant cutoff, Integer minScore, String label, Severity severity, int limit) {

    public AlertQuery {
        Objects.requireNonNull(cutoff, "cutoff");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
    }

    public static AlertQuery since(Instant cutoff, int limit) {
        return new AlertQuery(cutoff, null, null, null, limit);
    }

    public AlertQuery withMinScore(Integer value) {
        return new AlertQuery(cutoff, value, label, severity, limit);
    }

    public AlertQuery withLabel(String value) {
        return new AlertQuery(cutoff, minScore, value, severity, limit);
    }

    public AlertQuery withSeverity(Severity value) {
        return new AlertQuery(cutoff, minScore, label, value, limit);
    }

    public boolean matches(Alert alert) {
        if (alert.createdAt().isBefore(cutoff)) {
            return false;
        }
        if (minScore != null && alert.score() < minScore) {
            return false;
        }
        if (label != null && !label.isBlank() && !alert.labels().contains(label)) {
            return false;
        }
        return severity == null || alert.severity() == severity;
    }
}
