package com.llmids.alerts;

import java.time.Instant;
import java.util.List;

import com.llmids.scoring.Severity;

/**
 * A persisted, append-only alert. At most one exists per dedupe key.
 */
public record Alert(
        long id,
        String sessionId,
        Instant createdAt,
        int score,
        Severity severity,
        double confidence,
        List<String> labels,
        String topReason,
        String dedupeKey,
        AlertEnrichment enrichment,
        String timelineUrl) {

    public Alert {
        labels = List.copyOf(labels);
        enrichment = enrichment == null ? AlertEnrichment.empty() : enrichment;
    }

    public Alert withId(long newId) {
        return new Alert(newId, sessionId, createdAt, score, severity, confidence, labels, topReason, dedupeKey, enrichment, timelineUrl);
    }
}
