package com.llmids.routing;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Decision {
    ALLOW,
    REVIEW,
    BLOCK;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
