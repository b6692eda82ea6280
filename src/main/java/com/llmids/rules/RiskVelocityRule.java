package com.llmids.rules;

import java.util.ArrayList;
import java.util.List;

import com.llmids.features.KeywordDelta;
import com.llmids.features.SessionFeatures;

/**
 * Detects sudden jumps in keyword density rather than gradual growth.
 */
public class RiskVelocityRule implements DetectionRule {
    public static final String LABEL = "RISK_VELOCITY";

    private final int minKeywordDelta;
    private final int minSpikes;

    public RiskVelocityRule(int minKeywordDelta, int minSpikes) {
        this.minKeywordDelta = minKeywordDelta;
        this.minSpikes = minSpikes;
    }

    @Override
    public String label() {
        return LABEL;
    }

    @Override
    public String reason() {
        return LABEL;
    }

    @Override
    public int defaultWeight() {
        return 20;
    }

    @Override
    public RuleOutcome evaluate(SessionFeatures features) {
        Integer spikeTurn = null;
        int spikeDelta = 0;
        List<Integer> increaseTurns = new ArrayList<>();
        List<Integer> spikeTurns = new ArrayList<>();
        for (KeywordDelta delta : features.keywordDeltas()) {
            if (delta.delta() > 0) {
                increaseTurns.add(delta.turnId());
            }
            if (delta.delta() >= minKeywordDelta) {
                spikeTurns.add(delta.turnId());
            }
            if (delta.delta() > spikeDelta) {
                spikeDelta = delta.delta();
                spikeTurn = delta.turnId();
            }
        }
        Evidence evidence = new Evidence(
                features.maxUserKeywordDelta(),
                spikeTurn,
                spikeDelta,
                increaseTurns,
                spikeTurns,
                features.keywordDeltas(),
                minKeywordDelta,
                minSpikes);
        return new RuleOutcome(spikeTurns.size() >= minSpikes, evidence);
    }

    public record Evidence(
            int maxUserKeywordDelta,
            Integer spikeTurn,
            int spikeDelta,
            List<Integer> increaseTurns,
            List<Integer> spikeTurns,
            List<KeywordDelta> keywordDeltas,
            int minKeywordDelta,
            int minSpikes) implements RuleEvidence {
        @Override
        public String reason() {
            return LABEL;
        }
    }
}
