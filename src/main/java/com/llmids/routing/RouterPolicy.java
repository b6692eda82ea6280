package com.llmids.routing;

import java.util.Set;

public record RouterPolicy(int blockScore, int reviewScore, Set<String> blockLabels, Set<String> reviewLabels) {
    public static final int DEFAULT_BLOCK_SCORE = 85;
    public static final int DEFAULT_REVIEW_SCORE = 60;
    public static final Set<String> DEFAULT_BLOCK_LABELS = Set.of("RISK_VELOCITY", "WEAPON_INSTRUCTION", "DRUG_SYNTHESIS");
    public static final Set<String> DEFAULT_REVIEW_LABELS = Set.of(
            "CRESCENDO_ATTACK", "REFUSAL_REPHRASE", "DIRECT_PROMPT_ATTACK", "INTENT_TRAJECTORY");

    public RouterPolicy {
        blockLabels = Set.copyOf(blockLabels);
        reviewLabels = Set.copyOf(reviewLabels);
    }

    public static RouterPolicy defaults() {
        return new RouterPolicy(DEFAULT_BLOCK_SCORE, DEFAULT_REVIEW_SCORE, DEFAULT_BLOCK_LABELS, DEFAULT_REVIEW_LABELS);
    }
}
