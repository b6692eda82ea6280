package com.llmids.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.llmids.features.SessionFeatures;
import com.llmids.features.TurnText;

/**
 * Coarse signal: several user turns asking about parts, materials or assembly.
 */
public class IntentEscalationRule implements DetectionRule {
    public static final String LABEL = "INTENT_ESCALATION";

    static final Pattern ESCALATION_TERMS = TermMatcher.words(
            "materials", "components", "ingredients", "parts", "supplies",
            "what\\s+do\\s+i\\s+need", "how\\s+do\\s+i", "build", "assemble", "step\\s+by\\s+step");

    private final int minTurns;

    public IntentEscalationRule(int minTurns) {
        this.minTurns = minTurns;
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
        return 15;
    }

    @Override
    public RuleOutcome evaluate(SessionFeatures features) {
        List<Integer> turns = new ArrayList<>();
        List<String> terms = new ArrayList<>();
        for (TurnText turn : features.userTurnTexts()) {
            List<String> matched = TermMatcher.matchedTerms(ESCALATION_TERMS, turn.text());
            if (matched.isEmpty()) {
                continue;
            }
            turns.add(turn.turnId());
            matched.stream().filter(term -> !terms.contains(term)).forEach(terms::add);
        }
        return new RuleOutcome(turns.size() >= minTurns, new Evidence(minTurns, turns, terms));
    }

    public record Evidence(int minTurns, List<Integer> turns, List<String> matchedTerms) implements RuleEvidence {
        @Override
        public String reason() {
            return LABEL;
        }
    }
}
