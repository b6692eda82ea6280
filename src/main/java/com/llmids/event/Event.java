package com.llmids.event;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One message of a conversation. Events sharing a session id form a session, ordered by
 * turn id and then by insertion order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Event(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("turn_id") int turnId,
        Role role,
        String content,
        @JsonProperty("ts") @JsonAlias("timestamp") Instant timestamp,
        String model) {

    public static final Comparator<Event> TURN_ORDER = Comparator.comparingInt(Event::turnId);

    public Event {
        content = content == null ? "" : content;
    }

    public static Event user(String sessionId, int turnId, String content) {
        return new Event(sessionId, turnId, Role.USER, content, null, null);
    }

    public static Event assistant(String sessionId, int turnId, String content) {
        return new Event(sessionId, turnId, Role.ASSISTANT, content, null, null);
    }

    public boolean isUser() {
        return role == Role.USER;
    }

    public boolean isAssistant() {
        return role == Role.ASSISTANT;
    }

    public Event withContent(String newContent) {
        return new Event(sessionId, turnId, role, newContent, timestamp, model);
    }

    /**
     * Stable sort by turn id; events of the same turn keep their insertion order.
     */
    public static List<Event> inTurnOrder(List<Event> events) {
        return events.stream().sorted(TURN_ORDER).toList();
    }
}
