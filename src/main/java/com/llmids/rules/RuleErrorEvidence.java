package com.llmids.rules;

/**
 * Recorded in place of normal evidence when a rule throws during evaluation.
 */
public record RuleErrorEvidence(String rule, String error, String message) implements RuleEvidence {
    public static final String REASON = "RULE_ERROR";

    public static String key(String label) {
        return label + "_error";
    }

    public static RuleErrorEvidence of(String rule, RuntimeException e) {
        return new RuleErrorEvidence(rule, e.getClass().getSimpleName(), e.getMessage() == null ? "" : e.getMessage());
    }

    @Override
    public String reason() {
        return REASON;
    }
}
