package com.llmids.rules;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Explainability payload attached to a score result for each rule that fired.
 */
public interface RuleEvidence {

    @JsonProperty("reason")
    String reason();
}
