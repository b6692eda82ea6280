package com.llmids.scoring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Test;

class SeverityTest {

    @Test
    void shouldParseNamesAndMediumAlias() {
        assertEquals(Optional.of(Severity.MED), Severity.parse("medium"));
        assertEquals(Optional.of(Severity.HIGH), Severity.parse(" high "));
        assertTrue(Severity.parse("extreme").isEmpty());
        assertTrue(Severity.parse(null).isEmpty());
    }

    @Test
    void shouldCompareByRank() {
        assertTrue(Severity.CRITICAL.atLeast(Severity.HIGH));
        assertTrue(Severity.LOW.atLeast(Severity.LOW));
        assertTrue(!Severity.NONE.atLeast(Severity.LOW));
    }
}
