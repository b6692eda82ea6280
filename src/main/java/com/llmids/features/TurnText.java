package com.llmids.features;

public record TurnText(int turnId, String text) {
}
