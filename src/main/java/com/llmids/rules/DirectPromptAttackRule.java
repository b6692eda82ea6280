package com.llmids.rules;

import java.util.List;

import com.llmids.features.KeywordCount;
import com.llmids.features.SessionFeatures;

/**
 * Scans the whole keyword progression so a short final turn cannot hide an earlier dense one.
 */
public class DirectPromptAttackRule implements DetectionRule {
    public static final String LABEL = "DIRECT_PROMPT_ATTACK";

    private final int minKeywords;

    public DirectPromptAttackRule(int minKeywords) {
        this.minKeywords = minKeywords;
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
        return 40;
    }

    @Override
    public RuleOutcome evaluate(SessionFeatures features) {
        Integer peakTurn = null;
        int peakCount = 0;
        for (KeywordCount point : features.userKeywordProgression()) {
            if (point.count() > peakCount) {
                peakCount = point.count();
                peakTurn = point.turnId();
            }
        }
        Evidence evidence = new Evidence(minKeywords, peakCount, peakTurn, features.userKeywordProgression());
        return new RuleOutcome(peakCount >= minKeywords, evidence);
    }

    public record Evidence(
            int minKeywords,
            int maxKeywordCount,
            Integer peakTurn,
            List<KeywordCount> keywordProgression) implements RuleEvidence {
        @Override
        public String reason() {
            return LABEL;
        }
    }
}
