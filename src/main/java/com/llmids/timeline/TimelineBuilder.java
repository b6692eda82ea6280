package com.llmids.timeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import com.llmids.event.Event;
import com.llmids.features.RephraseHit;
import com.llmids.features.TurnFeatures;
import com.llmids.routing.Decision;
import com.llmids.rules.CrescendoRule;
import com.llmids.rules.DirectPromptAttackRule;
import com.llmids.rules.DrugSynthesisRule;
import com.llmids.rules.IntentEscalationRule;
import com.llmids.rules.IntentTrajectoryRule;
import com.llmids.rules.RefusalRephraseRule;
import com.llmids.rules.RiskVelocityRule;
import com.llmids.rules.WeaponInstructionRule;
import com.llmids.scoring.ScoreResult;
import com.llmids.scoring.ScoringEngine;
import com.llmids.scoring.Severity;

/**
 * Rebuilds "what changed, when" for a session by rescoring every growing turn prefix from scratch,
 * so each turn's evidence equals a fresh scoring call over that prefix. Cost grows with the square
 * of the turn count.
 */
public class TimelineBuilder {
    public static final int DEFAULT_TRUNCATE = 240;
    private static final int MAX_TOP_SIGNALS = 3;

    private final ScoringEngine engine;

    public TimelineBuilder(ScoringEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    public Timeline build(List<Event> events) {
        return build(events, true, DEFAULT_TRUNCATE);
    }

    public Timeline build(List<Event> events, boolean includeEvents, int truncate) {
        List<Event> ordered = events == null ? List.of() : Event.inTurnOrder(events);
        ScoreResult finalResult = engine.score(ordered);
        List<TurnFeatures> turnFeatures = engine.extractor().extractTurns(ordered);
        HighlightSources sources = HighlightSources.from(finalResult);

        List<TurnTimeline> turns = new ArrayList<>();
        List<Event> prefix = new ArrayList<>();
        int cursor = 0;
        ScoreResult previous = ScoreResult.neutral();
        for (TurnFeatures turn : turnFeatures) {
            while (cursor < ordered.size() && ordered.get(cursor).turnId() <= turn.turnId()) {
                prefix.add(ordered.get(cursor++));
            }
            ScoreResult current = engine.score(List.copyOf(prefix));
            turns.add(new TurnTimeline(
                    turn.turnId(),
                    turn.hasUser(),
                    turn.hasAssistant(),
                    turn.userKeywordCount(),
                    turn.assistantRefusal(),
                    current.score() - previous.score(),
                    difference(current.labels(), previous.labels()),
                    difference(current.reasons(), previous.reasons()),
                    current,
                    sources.highlightsFor(turn),
                    includeEvents ? truncated(turn.events(), truncate) : List.of()));
            previous = current;
        }

        return new Timeline(
                finalResult,
                recommendedAction(finalResult.severity()),
                explanation(finalResult),
                topSignals(finalResult),
                turns);
    }

    /**
     * Display-only mapping from severity; enforcement goes through the router.
     */
    static Decision recommendedAction(Severity severity) {
        return switch (severity) {
            case HIGH, CRITICAL -> Decision.BLOCK;
            case MED -> Decision.REVIEW;
            default -> Decision.ALLOW;
        };
    }

    static String explanation(ScoreResult result) {
        String explanation = "Scored " + result.score() + " (" + result.severity() + ").";
        if (!result.labels().isEmpty()) {
            explanation += " Triggered: " + String.join(", ", result.labels()) + ".";
        }
        return explanation;
    }

    static List<String> topSignals(ScoreResult result) {
        List<String> signals = new ArrayList<>();
        for (String label : result.labels()) {
            String signal = describe(label, result);
            if (signal != null) {
                signals.add(signal);
            }
            if (signals.size() == MAX_TOP_SIGNALS) {
                break;
            }
        }
        return signals;
    }

    private static String describe(String label, ScoreResult result) {
        return switch (label) {
            case RefusalRephraseRule.LABEL -> {
                RefusalRephraseRule.Evidence ev = result.evidenceOf(label, RefusalRephraseRule.Evidence.class);
                yield "Refusal+rephrase loop (hits=" + (ev == null ? 0 : ev.hitCount()) + ").";
            }
            case WeaponInstructionRule.LABEL -> {
                WeaponInstructionRule.Evidence ev = result.evidenceOf(label, WeaponInstructionRule.Evidence.class);
                yield "Weapon instruction phrasing matched (patterns=" + (ev == null ? 0 : ev.matchedPatterns().size()) + ").";
            }
            case DrugSynthesisRule.LABEL -> {
                DrugSynthesisRule.Evidence ev = result.evidenceOf(label, DrugSynthesisRule.Evidence.class);
                yield "Drug synthesis request (substances=" + (ev == null ? "" : String.join(", ", ev.substances())) + ").";
            }
            case DirectPromptAttackRule.LABEL -> {
                DirectPromptAttackRule.Evidence ev = result.evidenceOf(label, DirectPromptAttackRule.Evidence.class);
                yield "Direct prompt attack keywords (peak=" + (ev == null ? 0 : ev.maxKeywordCount()) + ").";
            }
            case IntentEscalationRule.LABEL -> {
                IntentEscalationRule.Evidence ev = result.evidenceOf(label, IntentEscalationRule.Evidence.class);
                yield "Escalating intent across " + (ev == null ? 0 : ev.turns().size()) + " turns.";
            }
            case IntentTrajectoryRule.LABEL -> {
                IntentTrajectoryRule.Evidence ev = result.evidenceOf(label, IntentTrajectoryRule.Evidence.class);
                yield "Trajectory toward execution (phases=" + (ev == null ? List.of() : ev.distinctPhases()) + ").";
            }
            case RiskVelocityRule.LABEL -> {
                RiskVelocityRule.Evidence ev = result.evidenceOf(label, RiskVelocityRule.Evidence.class);
                yield "Velocity spike (max_delta=" + (ev == null ? 0 : ev.maxUserKeywordDelta()) + ").";
            }
            case CrescendoRule.LABEL -> {
                CrescendoRule.Evidence ev = result.evidenceOf(label, CrescendoRule.Evidence.class);
                yield "Crescendo escalation (final_score=" + (ev == null ? 0 : ev.finalScore()) + ").";
            }
            default -> null;
        };
    }

    private static List<String> difference(List<String> current, List<String> previous) {
        return current.stream().filter(value -> !previous.contains(value)).toList();
    }

    private static List<Event> truncated(List<Event> events, int truncate) {
        if (truncate <= 0) {
            return events;
        }
        return events.stream()
                .map(event -> event.content().length() > truncate
                        ? event.withContent(event.content().substring(0, truncate) + "\u2026")
                        : event)
                .toList();
    }

    private record HighlightSources(
            Set<Integer> refusalTurns,
            List<RephraseHit> rephraseHits,
            Set<Integer> crescendoTurns,
            RiskVelocityRule.Evidence velocity) {

        static HighlightSources from(ScoreResult result) {
            RefusalRephraseRule.Evidence rephrase = result.evidenceOf(RefusalRephraseRule.LABEL, RefusalRephraseRule.Evidence.class);
            CrescendoRule.Evidence crescendo = result.evidenceOf(CrescendoRule.LABEL, CrescendoRule.Evidence.class);
            return new HighlightSources(
                    Set.copyOf(result.features().refusalTurnIds()),
                    rephrase == null ? List.of() : rephrase.hits(),
                    crescendo == null ? Set.of() : crescendo.turns().stream().collect(Collectors.toUnmodifiableSet()),
                    result.evidenceOf(RiskVelocityRule.LABEL, RiskVelocityRule.Evidence.class));
        }

        List<Highlight> highlightsFor(TurnFeatures turn) {
            int turnId = turn.turnId();
            List<Highlight> highlights = new ArrayList<>();
            if (refusalTurns.contains(turnId)) {
                highlights.add(Highlight.of("refusal", "Assistant refusal detected"));
            }
            rephraseHits.stream()
                    .filter(hit -> hit.rephraseTurn() == turnId)
                    .findFirst()
                    .ifPresent(hit -> highlights.add(new Highlight(
                            "rephrase", "User rephrased after refusal", "similarity=" + hit.similarity())));
            if (crescendoTurns.contains(turnId)) {
                highlights.add(Highlight.of("crescendo", "Escalation across turns"));
            }
            if (velocity != null && velocity.spikeTurn() != null && velocity.spikeTurn() == turnId) {
                highlights.add(new Highlight("velocity", "Velocity spike", "delta=" + velocity.spikeDelta()));
            }
            if (turn.userKeywordCount() > 0) {
                highlights.add(new Highlight("keywords", "Sensitive keywords", "count=" + turn.userKeywordCount()));
            }
            return highlights;
        }
    }
}
