package com.llmids.rules;

import java.util.List;

import com.llmids.features.RephraseHit;
import com.llmids.features.SessionFeatures;

/**
 * Assistant refused, then the user came back with a near-identical request.
 */
public class RefusalRephraseRule implements DetectionRule {
    public static final String LABEL = "REFUSAL_REPHRASE";
    public static final String REASON = "REFUSAL_EVASION_LOOP";

    private final int minRephrases;

    public RefusalRephraseRule(int minRephrases) {
        this.minRephrases = minRephrases;
    }

    @Override
    public String label() {
        return LABEL;
    }

    @Override
    public String reason() {
        return REASON;
    }

    @Override
    public int defaultWeight() {
        return 35;
    }

    @Override
    public RuleOutcome evaluate(SessionFeatures features) {
        List<RephraseHit> hits = features.rephraseHits();
        Evidence evidence = new Evidence(minRephrases, hits.size(), hits);
        return new RuleOutcome(hits.size() >= minRephrases, evidence);
    }

    public record Evidence(int minRephrases, int hitCount, List<RephraseHit> hits) implements RuleEvidence {
        @Override
        public String reason() {
            return REASON;
        }
    }
}
