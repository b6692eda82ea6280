package com.llmids.features;

import java.util.List;

public record FeatureConfig(
        List<String> sensitiveKeywords,
        double rephraseSimilarityThreshold,
        int rephraseWindowTurns) {

    public static final List<String> DEFAULT_SENSITIVE_KEYWORDS = List.of(
            "system prompt",
            "hidden prompt",
            "bypass",
            "exploit",
            "jailbreak",
            "override",
            "ignore instructions",
            "reveal instructions");
    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.35;
    public static final int DEFAULT_WINDOW_TURNS = 2;

    public FeatureConfig {
        sensitiveKeywords = List.copyOf(sensitiveKeywords);
    }

    public static FeatureConfig defaults() {
        return new FeatureConfig(DEFAULT_SENSITIVE_KEYWORDS, DEFAULT_SIMILARITY_THRESHOLD, DEFAULT_WINDOW_TURNS);
    }
}
