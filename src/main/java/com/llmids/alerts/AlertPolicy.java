package com.llmids.alerts;

import java.time.Duration;

public record AlertPolicy(int scoreThreshold, Duration activeWindow, int activeLimit) {
    public static final int DEFAULT_SCORE_THRESHOLD = 80;

    public static AlertPolicy defaults() {
        return new AlertPolicy(DEFAULT_SCORE_THRESHOLD, Duration.ofHours(1), 100);
    }
}
