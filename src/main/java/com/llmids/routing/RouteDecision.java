package com.llmids.routing;

import java.util.List;

import com.llmids.scoring.Severity;

public record RouteDecision(
        Decision decision,
        int score,
        Severity severity,
        List<String> labels,
        String topReason,
        String suggestedTarget,
        String timelineUrl,
        String alertsUrl) {

    public RouteDecision {
        labels = List.copyOf(labels);
    }
}
