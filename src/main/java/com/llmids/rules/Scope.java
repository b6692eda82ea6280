package com.llmids.rules;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which user text a phrase-level rule matched in.
 */
public enum Scope {
    LAST_USER,
    ALL_USER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
