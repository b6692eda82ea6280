package com.llmids.alerts;

import java.util.List;

import com.llmids.rules.RiskVelocityRule;
import com.llmids.scoring.ScoreResult;

public record AlertEnrichment(
        Integer spikeTurn,
        Integer spikeDelta,
        Integer maxUserKeywordDelta,
        List<Integer> increaseTurns) {

    public AlertEnrichment {
        increaseTurns = increaseTurns == null ? List.of() : List.copyOf(increaseTurns);
    }

    public static AlertEnrichment empty() {
        return new AlertEnrichment(null, null, null, List.of());
    }

    /**
     * Velocity details when the velocity rule fired; empty otherwise.
     */
    public static AlertEnrichment from(ScoreResult result) {
        RiskVelocityRule.Evidence velocity = result.evidenceOf(RiskVelocityRule.LABEL, RiskVelocityRule.Evidence.class);
        if (velocity == null) {
            return empty();
        }
        return new AlertEnrichment(
                velocity.spikeTurn(),
                velocity.spikeDelta(),
                velocity.maxUserKeywordDelta(),
                velocity.increaseTurns());
    }
}
