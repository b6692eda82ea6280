package com.llmids.timeline;

import java.util.List;

import com.llmids.event.Event;
import com.llmids.scoring.ScoreResult;

/**
 * State of the session as of one turn: the full rescoring of the event prefix plus what changed
 * relative to the previous turn.
 */
public record TurnTimeline(
        int turnId,
        boolean hasUser,
        boolean hasAssistant,
        int userKeywordCount,
        boolean assistantRefusal,
        int scoreDelta,
        List<String> newLabels,
        List<String> newReasons,
        ScoreResult result,
        List<Highlight> highlights,
        List<Event> events) {

    public TurnTimeline {
        newLabels = List.copyOf(newLabels);
        newReasons = List.copyOf(newReasons);
        highlights = List.copyOf(highlights);
        events = List.copyOf(events);
    }
}
