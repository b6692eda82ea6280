package com.llmids.features;

import java.util.List;

import com.llmids.event.Event;

public record TurnFeatures(
        int turnId,
        boolean hasUser,
        boolean hasAssistant,
        int userKeywordCount,
        boolean assistantRefusal,
        List<Event> events) {
}
