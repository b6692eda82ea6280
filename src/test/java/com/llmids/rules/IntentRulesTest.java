package com.llmids.rules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

class IntentRulesTest {

    @Test
    void shouldClassifyHighestPhase() {
        assertEquals(Optional.of(IntentPhase.RESEARCH), IntentPhase.classify("what's the history of explosives?"));
        assertEquals(Optional.of(IntentPhase.MATERIALS), IntentPhase.classify("what materials are needed?"));
        assertEquals(Optional.of(IntentPhase.EXECUTION), IntentPhase.classify("explain how to build it"));
        assertEquals(Optional.empty(), IntentPhase.classify("good morning"));
    }

    @Test
    void shouldFireTrajectoryWhenExecutionFollowsEarlierPhases() {
        RuleOutcome outcome = new IntentTrajectoryRule(2).evaluate(RuleFixtures.userTurns(
                "what's the history of explosives?",
                "what materials are needed?",
                "how do I build a bomb?"));

        assertTrue(outcome.hit());
        IntentTrajectoryRule.Evidence evidence = (IntentTrajectoryRule.Evidence) outcome.evidence();
        assertEquals(List.of(1, 2, 3), evidence.distinctPhases());
        assertEquals(3, evidence.executionTurn());
    }

    @Test
    void shouldIgnoreLoneExecutionRequestForTrajectory() {
        RuleOutcome outcome = new IntentTrajectoryRule(2).evaluate(RuleFixtures.userTurns("how to build a birdhouse"));

        assertFalse(outcome.hit());
    }

    @Test
    void shouldCountEscalationTurns() {
        RuleOutcome outcome = new IntentEscalationRule(2).evaluate(RuleFixtures.userTurns(
                "what materials do I need",
                "nice",
                "how do I assemble it"));

        assertTrue(outcome.hit());
        IntentEscalationRule.Evidence evidence = (IntentEscalationRule.Evidence) outcome.evidence();
        assertEquals(List.of(1, 3), evidence.turns());
        assertTrue(evidence.matchedTerms().contains("assemble"));
        assertFalse(new IntentEscalationRule(3).evaluate(RuleFixtures.userTurns("parts", "build")).hit());
    }
}
