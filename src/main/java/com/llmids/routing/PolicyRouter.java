package com.llmids.routing;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.llmids.scoring.ScoreResult;
import com.llmids.scoring.Severity;

/**
 * Maps a score result to allow / review / block. The hard safety check runs first and
 * short-circuits the threshold table.
 */
public class PolicyRouter {
    private static final Logger log = LoggerFactory.getLogger(PolicyRouter.class);

    public static final String HARD_SAFETY_LABEL = "HARD_SAFETY";
    public static final String SAFE_TARGET = "safe_llm";
    public static final String PRIMARY_TARGET = "primary_llm";

    private final RouterPolicy policy;

    public PolicyRouter() {
        this(RouterPolicy.defaults());
    }

    public PolicyRouter(RouterPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public RouteDecision route(String sessionId, ScoreResult result) {
        Objects.requireNonNull(result, "result");
        Optional<String> dangerous = HardSafetyGuard.detect(result.features());
        if (dangerous.isPresent()) {
            log.info("Hard safety override for session={} pattern={}", sessionId, dangerous.get());
            List<String> labels = new ArrayList<>(result.labels());
            if (!labels.contains(HARD_SAFETY_LABEL)) {
                labels.add(HARD_SAFETY_LABEL);
            }
            return new RouteDecision(
                    Decision.BLOCK,
                    result.score(),
                    Severity.HIGH,
                    labels,
                    HardSafetyGuard.REASON,
                    SAFE_TARGET,
                    timelineUrl(sessionId),
                    alertsUrl(sessionId));
        }

        Decision decision = Decision.ALLOW;
        if (result.score() >= policy.blockScore() || intersects(result.labels(), policy.blockLabels())) {
            decision = Decision.BLOCK;
        } else if (result.score() >= policy.reviewScore() || intersects(result.labels(), policy.reviewLabels())) {
            decision = Decision.REVIEW;
        }

        return new RouteDecision(
                decision,
                result.score(),
                result.severity(),
                result.labels(),
                result.topReason(),
                decision == Decision.ALLOW ? PRIMARY_TARGET : SAFE_TARGET,
                timelineUrl(sessionId),
                alertsUrl(sessionId));
    }

    public static String timelineUrl(String sessionId) {
        return "/v1/timeline/" + sessionId;
    }

    public static String alertsUrl(String sessionId) {
        return "/v1/alerts/" + sessionId;
    }

    private static boolean intersects(List<String> labels, Set<String> configured) {
        return labels.stream().anyMatch(configured::contains);
    }
}
