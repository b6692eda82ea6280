package com.llmids.rules;

import java.util.List;
import java.util.regex.Pattern;

import com.llmids.features.SessionFeatures;

/**
 * Fires only when a production verb and a named controlled substance appear in the same text.
 */
public class DrugSynthesisRule implements DetectionRule {
    public static final String LABEL = "DRUG_SYNTHESIS";

    static final Pattern SYNTHESIS_VERBS = TermMatcher.words(
            "make", "making", "cook", "cooking", "synthesi[sz]e", "synthesi[sz]ing", "synthesis",
            "extract", "extracting", "extraction", "recipe", "produce", "manufacture", "brew");
    static final Pattern SUBSTANCES = TermMatcher.words(
            "crystal\\s+meth", "methamphetamine", "meth", "fentanyl", "carfentanil", "heroin", "cocaine",
            "lsd", "mdma", "ecstasy", "ghb", "pcp", "ketamine", "dmt");

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
        return 70;
    }

    @Override
    public RuleOutcome evaluate(SessionFeatures features) {
        Evidence last = scan(Scope.LAST_USER, features.lastUserContent());
        if (last.conjunctive()) {
            return RuleOutcome.hit(last);
        }
        Evidence all = scan(Scope.ALL_USER, features.allUserContent());
        return new RuleOutcome(all.conjunctive(), all);
    }

    private static Evidence scan(Scope scope, String text) {
        return new Evidence(scope, TermMatcher.matchedTerms(SYNTHESIS_VERBS, text), TermMatcher.matchedTerms(SUBSTANCES, text));
    }

    public record Evidence(Scope scope, List<String> verbs, List<String> substances) implements RuleEvidence {
        boolean conjunctive() {
            return !verbs.isEmpty() && !substances.isEmpty();
        }

        @Override
        public String reason() {
            return LABEL;
        }
    }
}
