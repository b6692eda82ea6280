package com.llmids.event;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class SessionIdsTest {

    @Test
    void shouldNormalizeSessionIds() {
        assertEquals("my_session-1", SessionIds.normalize("  My Session-1! "));
        assertEquals("default", SessionIds.normalize(null));
        assertEquals("default", SessionIds.normalize("???"));
        assertEquals(64, SessionIds.normalize("x".repeat(100)).length());
    }
}
