package com.llmids.rules;

public record RuleThresholds(
        int refusalMinRephrases,
        int directAttackMinKeywords,
        int escalationMinTurns,
        int trajectoryMinPhases,
        int velocityMinKeywordDelta,
        int velocityMinSpikes,
        int crescendoMinKeywordDelta) {

    public static RuleThresholds defaults() {
        return new RuleThresholds(1, 2, 2, 2, 2, 2, 2);
    }
}
