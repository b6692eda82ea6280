package com.llmids.rules;

public record RuleOutcome(boolean hit, RuleEvidence evidence) {

    public static RuleOutcome hit(RuleEvidence evidence) {
        return new RuleOutcome(true, evidence);
    }

    public static RuleOutcome miss(RuleEvidence evidence) {
        return new RuleOutcome(false, evidence);
    }
}
