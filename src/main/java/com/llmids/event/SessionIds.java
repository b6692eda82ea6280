package com.llmids.event;

import java.util.Locale;
import java.util.regex.Pattern;

public final class SessionIds {
    public static final int MAX_LENGTH = 64;
    public static final String DEFAULT_SESSION = "default";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern ILLEGAL = Pattern.compile("[^a-z0-9_\\-]");

    private SessionIds() {
    }

    public static String normalize(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return DEFAULT_SESSION;
        }
        String normalized = WHITESPACE.matcher(sessionId.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
        normalized = ILLEGAL.matcher(normalized).replaceAll("");
        if (normalized.length() > MAX_LENGTH) {
            normalized = normalized.substring(0, MAX_LENGTH);
        }
        return normalized.isEmpty() ? DEFAULT_SESSION : normalized;
    }
}
