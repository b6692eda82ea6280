package com.llmids.event;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Role {
    USER,
    ASSISTANT,
    SYSTEM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Role fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("role is required");
        }
        return Role.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
