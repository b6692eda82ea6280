package com.llmids.rules;

import com.llmids.features.SessionFeatures;

/**
 * A pure evaluator over session features. Implementations must not keep state between calls.
 */
public interface DetectionRule {

    /**
     * Label added to the score result when the rule fires; also the weight lookup key.
     */
    String label();

    /**
     * Reason code appended to the score result's reasons when the rule fires.
     */
    String reason();

    int defaultWeight();

    RuleOutcome evaluate(SessionFeatures features);
}
