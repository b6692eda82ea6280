package com.llmids.runtime;

import java.util.Objects;

import com.llmids.alerts.AlertPolicy;
import com.llmids.features.FeatureConfig;
import com.llmids.routing.RouterPolicy;
import com.llmids.rules.RuleThresholds;
import com.llmids.scoring.ScoringConfig;

/**
 * Fully resolved, immutable configuration for the detection pipeline. Built once and passed by
 * reference; nothing downstream reads the environment.
 */
public record DetectionSettings(
        FeatureConfig features,
        ScoringConfig scoring,
        RuleThresholds rules,
        RouterPolicy router,
        AlertPolicy alerts) {

    public DetectionSettings {
        Objects.requireNonNull(features, "features");
        Objects.requireNonNull(scoring, "scoring");
        Objects.requireNonNull(rules, "rules");
        Objects.requireNonNull(router, "router");
        Objects.requireNonNull(alerts, "alerts");
    }

    public static DetectionSettings defaults() {
        return new DetectionSettings(
                FeatureConfig.defaults(),
                ScoringConfig.defaults(),
                RuleThresholds.defaults(),
                RouterPolicy.defaults(),
                AlertPolicy.defaults());
    }
}
