package com.llmids.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

import com.llmids.features.SessionFeatures;
import com.llmids.features.TurnText;

/**
 * Rewards progression toward execution rather than a single mention of it.
 */
public class IntentTrajectoryRule implements DetectionRule {
    public static final String LABEL = "INTENT_TRAJECTORY";

    private final int minDistinctPhases;

    public IntentTrajectoryRule(int minDistinctPhases) {
        this.minDistinctPhases = minDistinctPhases;
    }

    @Override
    public String label() {
        return LABEL;
    }

    @Override
    public String reason() {
        return LABEL;
    }

    @Override
    public int defaultWeight() {
        return 30;
    }

    @Override
    public RuleOutcome evaluate(SessionFeatures features) {
        List<PhaseMark> marks = new ArrayList<>();
        TreeSet<Integer> distinct = new TreeSet<>();
        Integer executionTurn = null;
        for (TurnText turn : features.userTurnTexts()) {
            Optional<IntentPhase> phase = IntentPhase.classify(turn.text());
            if (phase.isEmpty()) {
                continue;
            }
            marks.add(new PhaseMark(turn.turnId(), phase.get()));
            distinct.add(phase.get().level());
            if (phase.get() == IntentPhase.EXECUTION && executionTurn == null) {
                executionTurn = turn.turnId();
            }
        }
        boolean hit = executionTurn != null && distinct.size() >= minDistinctPhases;
        return new RuleOutcome(hit, new Evidence(marks, List.copyOf(distinct), executionTurn, minDistinctPhases));
    }

    public record PhaseMark(int turnId, IntentPhase phase) {
    }

    public record Evidence(
            List<PhaseMark> phases,
            List<Integer> distinctPhases,
            Integer executionTurn,
            int minDistinctPhases) implements RuleEvidence {
        @Override
        public String reason() {
            return LABEL;
        }
    }
}
