package com.llmids.scoring;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

import com.llmids.rules.DetectionRule;

/**
 * Immutable scoring parameters. Weights resolve explicit value, then fallback value, then the
 * rule's built-in default.
 */
public record ScoringConfig(
        int baseline,
        int cap,
        int maxTheoreticalScore,
        Map<String, Integer> weights,
        Map<String, Integer> fallbackWeights,
        List<SeverityBand> severityBands) {

    public static final int DEFAULT_CAP = 100;
    public static final int DEFAULT_MAX_THEORETICAL_SCORE = 300;
    public static final List<SeverityBand> DEFAULT_BANDS = List.of(
            new SeverityBand(0, Severity.NONE),
            new SeverityBand(1, Severity.LOW),
            new SeverityBand(40, Severity.MED),
            new SeverityBand(70, Severity.HIGH));

    public ScoringConfig {
        weights = Map.copyOf(weights);
        fallbackWeights = Map.copyOf(fallbackWeights);
        severityBands = severityBands.stream()
                .sorted(Comparator.comparingInt(SeverityBand::minScore))
                .toList();
    }

    public static ScoringConfig defaults() {
        return new ScoringConfig(0, DEFAULT_CAP, DEFAULT_MAX_THEORETICAL_SCORE, Map.of(), Map.of(), DEFAULT_BANDS);
    }

    public int weightFor(DetectionRule rule) {
        Integer explicit = weights.get(rule.label());
        if (explicit != null) {
            return explicit;
        }
        Integer fallback = fallbackWeights.get(rule.label());
        return fallback != null ? fallback : rule.defaultWeight();
    }

    /**
     * Highest band whose threshold the score meets; equal thresholds resolve to the later band.
     */
    public Severity severityFor(int score) {
        Severity severity = Severity.NONE;
        for (SeverityBand band : severityBands) {
            if (score >= band.minScore()) {
                severity = band.severity();
            }
        }
        return severity;
    }
}
