package com.llmids.rules;

import java.util.List;

import com.llmids.features.KeywordCount;
import com.llmids.features.SessionFeatures;

/**
 * Fires on the single strongest turn-to-turn jump, independent of how many jumps there were.
 */
public class CrescendoRule implements DetectionRule {
    public static final String LABEL = "CRESCENDO_ATTACK";
    public static final String REASON = "CRESCENDO_ESCALATION";

    private final int minKeywordDelta;

    public CrescendoRule(int minKeywordDelta) {
        this.minKeywordDelta = minKeywordDelta;
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
        return 55;
    }

    @Override
    public RuleOutcome evaluate(SessionFeatures features) {
        List<KeywordCount> progression = features.userKeywordProgression();
        int finalScore = progression.isEmpty() ? 0 : progression.get(progression.size() - 1).count();
        Evidence evidence = new Evidence(
                features.increaseTurns(),
                features.maxUserKeywordDelta(),
                finalScore,
                progression,
                minKeywordDelta);
        return new RuleOutcome(features.maxUserKeywordDelta() >= minKeywordDelta, evidence);
    }

    public record Evidence(
            List<Integer> turns,
            int maxUserKeywordDelta,
            int finalScore,
            List<KeywordCount> keywordProgression,
            int minKeywordDelta) implements RuleEvidence {
        @Override
        public String reason() {
            return REASON;
        }
    }
}
