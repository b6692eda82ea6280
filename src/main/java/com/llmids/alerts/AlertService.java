package com.llmids.alerts;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.llmids.routing.PolicyRouter;
import com.llmids.scoring.ScoreResult;
import com.llmids.scoring.Severity;

/**
 * Decides whether a score result is alert-worthy and records at most one alert per
 * (session, top reason) for the lifetime of the store.
 */
public class AlertService {
    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private final AlertStore store;
    private final AlertPolicy policy;
    private final Clock clock;

    public AlertService(AlertStore store) {
        this(store, AlertPolicy.defaults(), Clock.systemUTC());
    }

    public AlertService(AlertStore store, AlertPolicy policy, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the new alert, or empty when the score is below threshold or the dedupe key was
     * already alerted.
     */
    public Optional<Alert> maybeEmitAlert(String sessionId, ScoreResult result) {
        Objects.requireNonNull(result, "result");
        if (result.score() < policy.scoreThreshold()) {
            return Optional.empty();
        }
        String topReason = result.topReason();
        Alert candidate = new Alert(
                0L,
                sessionId,
                clock.instant(),
                result.score(),
                result.severity(),
                result.confidence(),
                result.labels(),
                topReason,
                dedupeKey(sessionId, topReason),
                AlertEnrichment.from(result),
                PolicyRouter.timelineUrl(sessionId));

        Optional<Alert> stored = store.insertIfAbsent(candidate);
        stored.ifPresentOrElse(
                alert -> log.info("Alert emitted id={} session={} score={} severity={} topReason={}",
                        alert.id(), sessionId, alert.score(), alert.severity(), topReason.isEmpty() ? "none" : topReason),
                () -> log.debug("Alert suppressed for dedupeKey={}", candidate.dedupeKey()));
        return stored;
    }

    public List<Alert> activeAlerts() {
        return activeAlerts(policy.activeWindow(), null, null, null, policy.activeLimit());
    }

    public List<Alert> activeAlerts(Duration window, Integer minScore, String label, Severity severity, int limit) {
        AlertQuery query = AlertQuery.since(clock.instant().minus(window), limit)
                .withMinScore(minScore)
                .withLabel(label)
                .withSeverity(severity);
        return store.findActive(query);
    }

    public List<Alert> alertsForSession(String sessionId) {
        return store.findBySession(sessionId);
    }

    public List<Alert> recentAlerts(int limit) {
        return store.listRecent(limit);
    }

    /**
     * Sessions without a reason share the empty-reason key.
     */
    public static String dedupeKey(String sessionId, String topReason) {
        return sessionId + ":" + (topReason == null ? "" : topReason);
    }
}
