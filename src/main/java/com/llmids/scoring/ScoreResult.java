package com.llmids.scoring;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.llmids.features.SessionFeatures;
import com.llmids.rules.RuleEvidence;

@JsonPropertyOrder({ "score", "severity", "confidence", "risk_tier", "labels", "reasons", "evidence" })
public record ScoreResult(
        int score,
        Severity severity,
        double confidence,
        RiskTier riskTier,
        List<String> labels,
        List<String> reasons,
        Map<String, RuleEvidence> evidence,
        @JsonIgnore SessionFeatures features) {

    public ScoreResult {
        labels = List.copyOf(labels);
        reasons = List.copyOf(reasons);
        evidence = Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
        features = features == null ? SessionFeatures.empty() : features;
    }

    public static ScoreResult neutral() {
        return new ScoreResult(0, Severity.NONE, 0.0, RiskTier.NONE, List.of(), List.of(), Map.of(), SessionFeatures.empty());
    }

    /**
     * First reason produced by scoring, or the empty string.
     */
    @JsonIgnore
    public String topReason() {
        return reasons.isEmpty() ? "" : reasons.get(0);
    }

    public <T extends RuleEvidence> T evidenceOf(String label, Class<T> type) {
        RuleEvidence value = evidence.get(label);
        return type.isInstance(value) ? type.cast(value) : null;
    }
}
