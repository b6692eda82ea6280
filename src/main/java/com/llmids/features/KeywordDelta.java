package com.llmids.features;

/**
 * Change in sensitive keyword count between a user turn and the previous user turn.
 */
public record KeywordDelta(int turnId, int delta) {
}
