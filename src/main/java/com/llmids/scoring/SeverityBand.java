package com.llmids.scoring;

public record SeverityBand(int minScore, Severity severity) {
}
