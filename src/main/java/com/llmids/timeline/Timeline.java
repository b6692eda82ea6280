package com.llmids.timeline;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.llmids.routing.Decision;
import com.llmids.scoring.ScoreResult;

public record Timeline(
        @JsonProperty("final") ScoreResult finalResult,
        Decision recommendedAction,
        String explanation,
        List<String> topSignals,
        List<TurnTimeline> turns) {

    public Timeline {
        topSignals = List.copyOf(topSignals);
        turns = List.copyOf(turns);
    }
}
