package com.llmids.rules;

import java.util.Optional;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;
import com.llmids.features.TextNormalizer;

/**
 * Ordered stages of a request moving from curiosity toward carrying something out.
 */
public enum IntentPhase {
    RESEARCH(1, TermMatcher.words(
            "history", "what\\s+is", "what\\s+are", "what's", "explain", "overview",
            "tell\\s+me\\s+about", "learn\\s+about", "why", "background")),
    MATERIALS(2, TermMatcher.words(
            "materials", "components", "ingredients", "parts", "supplies", "chemicals",
            "what\\s+do\\s+i\\s+need", "needed", "where\\s+(?:can\\s+i\\s+)?(?:buy|get)")),
    EXECUTION(3, TermMatcher.words(
            "how\\s+do\\s+i", "how\\s+to", "how\\s+can\\s+i", "build", "assemble", "construct",
            "step\\s+by\\s+step", "step-by-step", "instructions", "detonate"));

    private final int level;
    private final Pattern pattern;

    IntentPhase(int level, Pattern pattern) {
        this.level = level;
        this.pattern = pattern;
    }

    @JsonValue
    public int level() {
        return level;
    }

    /**
     * Highest phase whose terms appear in the text.
     */
    public static Optional<IntentPhase> classify(String text) {
        String normalized = TextNormalizer.normalize(text);
        IntentPhase[] phases = values();
        for (int i = phases.length - 1; i >= 0; i--) {
            if (phases[i].pattern.matcher(normalized).find()) {
                return Optional.of(phases[i]);
            }
        }
        return Optional.empty();
    }
}
