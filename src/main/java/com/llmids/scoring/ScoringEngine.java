package com.llmids.scoring;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.llmids.event.Event;
import com.llmids.features.SessionFeatureExtractor;
import com.llmids.features.SessionFeatures;
import com.llmids.rules.DetectionRule;
import com.llmids.rules.DetectionRules;
import com.llmids.rules.RuleErrorEvidence;
import com.llmids.rules.RuleEvidence;
import com.llmids.rules.RuleOutcome;
import com.llmids.rules.RuleThresholds;

/**
 * Runs every rule over a session's features and fuses the hits into a clamped score with
 * severity, confidence and risk tier. Stateless per call and safe to share across threads.
 */
public class ScoringEngine {
    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);
    private static final double CONFIDENCE_EXPONENT = 0.85;

    private final ScoringConfig config;
    private final SessionFeatureExtractor extractor;
    private final List<DetectionRule> rules;

    public ScoringEngine() {
        this(ScoringConfig.defaults(), new SessionFeatureExtractor(), DetectionRules.standard(RuleThresholds.defaults()));
    }

    public ScoringEngine(ScoringConfig config, SessionFeatureExtractor extractor, List<DetectionRule> rules) {
        this.config = Objects.requireNonNull(config, "config");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.rules = List.copyOf(rules);
    }

    public ScoreResult score(List<Event> events) {
        if (events == null || events.isEmpty()) {
            return ScoreResult.neutral();
        }
        return score(extractor.extract(events));
    }

    public ScoreResult score(SessionFeatures features) {
        int score = config.baseline();
        Set<String> labels = new LinkedHashSet<>();
        List<String> reasons = new ArrayList<>();
        Map<String, RuleEvidence> evidence = new LinkedHashMap<>();

        for (DetectionRule rule : rules) {
            RuleOutcome outcome;
            try {
                outcome = Objects.requireNonNull(rule.evaluate(features), "rule outcome");
            } catch (RuntimeException e) {
                log.warn("Rule {} failed during evaluation; continuing with remaining rules", rule.label(), e);
                evidence.put(RuleErrorEvidence.key(rule.label()), RuleErrorEvidence.of(rule.label(), e));
                continue;
            }
            if (!outcome.hit()) {
                continue;
            }
            if (labels.add(rule.label())) {
                reasons.add(rule.reason());
            }
            evidence.putIfAbsent(rule.label(), outcome.evidence());
            score += config.weightFor(rule);
        }

        score += persistenceBonus(features.userTurnCount());
        score = clamp(score, 0, config.cap());
        Severity severity = config.severityFor(score);
        double confidence = confidence(score);

        log.debug("Scored session turns={} score={} severity={} labels={}", features.turnCount(), score, severity, labels);
        return new ScoreResult(
                score,
                severity,
                confidence,
                RiskTier.fromConfidence(confidence),
                List.copyOf(labels),
                reasons,
                evidence,
                features);
    }

    public SessionFeatureExtractor extractor() {
        return extractor;
    }

    public ScoringConfig config() {
        return config;
    }

    /**
     * Sustained multi-turn probing is penalized even when no single rule fires strongly.
     */
    public static int persistenceBonus(int userTurnCount) {
        if (userTurnCount >= 5) {
            return 15;
        }
        if (userTurnCount >= 3) {
            return 5;
        }
        return 0;
    }

    double confidence(int score) {
        if (score <= 0) {
            return 0.0;
        }
        double ratio = (double) score / config.maxTheoreticalScore();
        double curved = Math.pow(ratio, CONFIDENCE_EXPONENT);
        return Math.min(1.0, Math.round(curved * 1000.0) / 1000.0);
    }

    private static int clamp(int value, int low, int high) {
        return Math.max(low, Math.min(high, value));
    }
}
