package com.llmids.features;

public record KeywordCount(int turnId, int count) {
}
