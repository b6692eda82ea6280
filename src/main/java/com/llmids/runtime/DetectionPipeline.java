package com.llmids.runtime;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.llmids.alerts.Alert;
import com.llmids.alerts.AlertService;
import com.llmids.alerts.AlertStore;
import com.llmids.event.Event;
import com.llmids.event.SessionIds;
import com.llmids.features.SessionFeatureExtractor;
import com.llmids.routing.PolicyRouter;
import com.llmids.routing.RouteDecision;
import com.llmids.rules.DetectionRules;
import com.llmids.scoring.ScoreResult;
import com.llmids.scoring.ScoringEngine;
import com.llmids.timeline.Timeline;
import com.llmids.timeline.TimelineBuilder;

/**
 * Wires extractor, rules, engine, router, alerts and timeline from one {@link DetectionSettings}.
 */
public class DetectionPipeline {
    private static final Logger log = LoggerFactory.getLogger(DetectionPipeline.class);

    private final DetectionSettings settings;
    private final ScoringEngine engine;
    private final PolicyRouter router;
    private final AlertService alertService;
    private final TimelineBuilder timelineBuilder;

    public DetectionPipeline(DetectionSettings settings, AlertStore alertStore) {
        this(settings, alertStore, Clock.systemUTC());
    }

    public DetectionPipeline(DetectionSettings settings, AlertStore alertStore, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.engine = new ScoringEngine(
                settings.scoring(),
                new SessionFeatureExtractor(settings.features()),
                DetectionRules.standard(settings.rules()));
        this.router = new PolicyRouter(settings.router());
        this.alertService = new AlertService(alertStore, settings.alerts(), clock);
        this.timelineBuilder = new TimelineBuilder(engine);
    }

    public ScoreResult score(List<Event> events) {
        return engine.score(events);
    }

    public RouteDecision route(String sessionId, List<Event> events) {
        return router.route(SessionIds.normalize(sessionId), engine.score(events));
    }

    /**
     * Scores, routes and records an alert when the result crosses the alert threshold.
     */
    public Evaluation evaluate(String sessionId, List<Event> events) {
        String session = SessionIds.normalize(sessionId);
        ScoreResult result = engine.score(events);
        RouteDecision decision = router.route(session, result);
        Optional<Alert> alert = alertService.maybeEmitAlert(session, result);
        log.debug("Evaluated session={} score={} decision={} alert={}",
                session, result.score(), decision.decision(), alert.isPresent());
        return new Evaluation(session, result, decision, alert.orElse(null));
    }

    public Timeline timeline(List<Event> events, boolean includeEvents, int truncate) {
        return timelineBuilder.build(events, includeEvents, truncate);
    }

    public DetectionSettings settings() {
        return settings;
    }

    public ScoringEngine engine() {
        return engine;
    }

    public PolicyRouter router() {
        return router;
    }

    public AlertService alerts() {
        return alertService;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Evaluation(String sessionId, ScoreResult result, RouteDecision route, Alert alert) {
    }
}
