package com.llmids.runtime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.llmids.alerts.AlertPolicy;
import com.llmids.features.FeatureConfig;
import com.llmids.routing.RouterPolicy;
import com.llmids.rules.RuleThresholds;
import com.llmids.scoring.ScoringConfig;
import com.llmids.scoring.Severity;
import com.llmids.scoring.SeverityBand;

/**
 * Turns the YAML bean plus an environment snapshot into {@link DetectionSettings}. Each value is
 * taken from the YAML file first, then the environment, then the built-in default. Invalid values
 * are logged and replaced by the default; resolution never fails.
 */
public class DetectionSettingsResolver {
    private static final Logger log = LoggerFactory.getLogger(DetectionSettingsResolver.class);

    static final String WEIGHT_PREFIX = "IDS_WEIGHT_";
    static final String KEYWORDS_ENV = "IDS_CRESCENDO_KEYWORDS";
    static final String SIMILARITY_ENV = "REFUSAL_SIM_THRESHOLD";
    static final String WINDOW_ENV = "REFUSAL_WINDOW_TURNS";
    static final String BLOCK_SCORE_ENV = "IDS_ROUTE_BLOCK_SCORE";
    static final String REVIEW_SCORE_ENV = "IDS_ROUTE_REVIEW_SCORE";
    static final String BLOCK_LABELS_ENV = "IDS_ROUTE_BLOCK_LABELS";
    static final String REVIEW_LABELS_ENV = "IDS_ROUTE_REVIEW_LABELS";
    static final String ALERT_THRESHOLD_ENV = "IDS_ALERT_THRESHOLD";

    private final Map<String, String> environment;

    public DetectionSettingsResolver() {
        this(System.getenv());
    }

    public DetectionSettingsResolver(Map<String, String> environment) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
    }

    public DetectionSettings resolve(AppConfig config) {
        AppConfig source = config == null ? new AppConfig() : config;
        return new DetectionSettings(
                resolveFeatures(source.getFeatures()),
                resolveScoring(source.getScoring()),
                resolveRules(source.getRules()),
                resolveRouter(source.getRouter()),
                resolveAlerts(source.getAlerts()));
    }

    private FeatureConfig resolveFeatures(AppConfig.FeaturesConfig features) {
        List<String> keywords = cleanList(features.getSensitiveKeywords());
        if (keywords.isEmpty()) {
            keywords = csv(environment.get(KEYWORDS_ENV));
        }
        if (keywords.isEmpty()) {
            keywords = FeatureConfig.DEFAULT_SENSITIVE_KEYWORDS;
        }

        double threshold = FeatureConfig.DEFAULT_SIMILARITY_THRESHOLD;
        Double configured = features.getRephraseSimilarityThreshold();
        if (configured != null && configured >= 0.0 && configured <= 1.0) {
            threshold = configured;
        } else {
            if (configured != null) {
                log.warn("Ignoring rephraseSimilarityThreshold={} outside [0, 1]", configured);
            }
            Optional<Double> fromEnv = envDouble(SIMILARITY_ENV).filter(value -> value >= 0.0 && value <= 1.0);
            if (fromEnv.isPresent()) {
                threshold = fromEnv.get();
            } else if (environment.containsKey(SIMILARITY_ENV)) {
                log.warn("Ignoring {}={}; expected a number in [0, 1]", SIMILARITY_ENV, environment.get(SIMILARITY_ENV));
            }
        }

        int window = positiveInt("rephraseWindowTurns", features.getRephraseWindowTurns(), WINDOW_ENV,
                FeatureConfig.DEFAULT_WINDOW_TURNS);
        return new FeatureConfig(keywords, threshold, window);
    }

    private ScoringConfig resolveScoring(AppConfig.ScoringSection scoring) {
        int baseline = scoring.getBaseline() == null ? 0 : scoring.getBaseline();
        int cap = positiveInt("cap", scoring.getCap(), null, ScoringConfig.DEFAULT_CAP);
        int maxTheoretical = positiveInt("maxTheoreticalScore", scoring.getMaxTheoreticalScore(), null,
                ScoringConfig.DEFAULT_MAX_THEORETICAL_SCORE);

        Map<String, Integer> weights = new LinkedHashMap<>();
        scoring.getWeights().forEach((label, weight) -> {
            if (label == null || label.isBlank() || weight == null || weight < 0) {
                log.warn("Ignoring scoring weight {}={}", label, weight);
            } else {
                weights.put(label.trim().toUpperCase(Locale.ROOT), weight);
            }
        });

        Map<String, Integer> fallbackWeights = new LinkedHashMap<>();
        environment.forEach((key, value) -> {
            if (!key.startsWith(WEIGHT_PREFIX) || key.length() == WEIGHT_PREFIX.length()) {
                return;
            }
            Optional<Integer> parsed = parseInt(value).filter(weight -> weight >= 0);
            if (parsed.isPresent()) {
                fallbackWeights.put(key.substring(WEIGHT_PREFIX.length()), parsed.get());
            } else {
                log.warn("Ignoring {}={}; expected a non-negative integer", key, value);
            }
        });

        List<SeverityBand> bands = new ArrayList<>();
        for (AppConfig.BandConfig band : scoring.getSeverityBands()) {
            if (band == null) {
                continue;
            }
            Optional<Severity> severity = Severity.parse(band.getSeverity());
            if (severity.isEmpty() || band.getMinScore() == null || band.getMinScore() < 0) {
                log.warn("Ignoring severity band severity={} minScore={}",
                        band.getSeverity(), band.getMinScore());
                continue;
            }
            bands.add(new SeverityBand(band.getMinScore(), severity.get()));
        }
        if (bands.isEmpty()) {
            bands = ScoringConfig.DEFAULT_BANDS;
        }

        return new ScoringConfig(baseline, cap, maxTheoretical, weights, fallbackWeights, bands);
    }

    private RuleThresholds resolveRules(AppConfig.RulesSection rules) {
        RuleThresholds defaults = RuleThresholds.defaults();
        return new RuleThresholds(
                positiveInt("refusalMinRephrases", rules.getRefusalMinRephrases(), null, defaults.refusalMinRephrases()),
                positiveInt("directAttackMinKeywords", rules.getDirectAttackMinKeywords(), null, defaults.directAttackMinKeywords()),
                positiveInt("escalationMinTurns", rules.getEscalationMinTurns(), null, defaults.escalationMinTurns()),
                positiveInt("trajectoryMinPhases", rules.getTrajectoryMinPhases(), null, defaults.trajectoryMinPhases()),
                positiveInt("velocityMinKeywordDelta", rules.getVelocityMinKeywordDelta(), null, defaults.velocityMinKeywordDelta()),
                positiveInt("velocityMinSpikes", rules.getVelocityMinSpikes(), null, defaults.velocityMinSpikes()),
                positiveInt("crescendoMinKeywordDelta", rules.getCrescendoMinKeywordDelta(), null, defaults.crescendoMinKeywordDelta()));
    }

    private RouterPolicy resolveRouter(AppConfig.RouterSection router) {
        int blockScore = positiveInt("blockScore", router.getBlockScore(), BLOCK_SCORE_ENV, RouterPolicy.DEFAULT_BLOCK_SCORE);
        int reviewScore = positiveInt("reviewScore", router.getReviewScore(), REVIEW_SCORE_ENV, RouterPolicy.DEFAULT_REVIEW_SCORE);
        return new RouterPolicy(
                blockScore,
                reviewScore,
                labels(router.getBlockLabels(), BLOCK_LABELS_ENV, RouterPolicy.DEFAULT_BLOCK_LABELS),
                labels(router.getReviewLabels(), REVIEW_LABELS_ENV, RouterPolicy.DEFAULT_REVIEW_LABELS));
    }

    private AlertPolicy resolveAlerts(AppConfig.AlertsSection alerts) {
        AlertPolicy defaults = AlertPolicy.defaults();
        int threshold = positiveInt("scoreThreshold", alerts.getScoreThreshold(), ALERT_THRESHOLD_ENV,
                defaults.scoreThreshold());
        Duration window = defaults.activeWindow();
        Long seconds = alerts.getActiveWindowSeconds();
        if (seconds != null && seconds > 0) {
            window = Duration.ofSeconds(seconds);
        } else if (seconds != null) {
            log.warn("Ignoring activeWindowSeconds={}; using {}", seconds, window);
        }
        int limit = positiveInt("activeLimit", alerts.getActiveLimit(), null, defaults.activeLimit());
        return new AlertPolicy(threshold, window, limit);
    }

    private int positiveInt(String name, Integer configured, String envKey, int fallback) {
        if (configured != null) {
            if (configured > 0) {
                return configured;
            }
            log.warn("Ignoring {}={}; expected a positive integer", name, configured);
        }
        if (envKey != null && environment.containsKey(envKey)) {
            Optional<Integer> parsed = parseInt(environment.get(envKey)).filter(value -> value > 0);
            if (parsed.isPresent()) {
                return parsed.get();
            }
            log.warn("Ignoring {}={}; expected a positive integer", envKey, environment.get(envKey));
        }
        return fallback;
    }

    private Set<String> labels(List<String> configured, String envKey, Set<String> fallback) {
        List<String> labels = cleanList(configured);
        if (configured == null || labels.isEmpty()) {
            labels = csv(environment.get(envKey));
        }
        if (labels.isEmpty()) {
            return fallback;
        }
        Set<String> normalized = new LinkedHashSet<>();
        labels.forEach(label -> normalized.add(label.toUpperCase(Locale.ROOT)));
        return normalized;
    }

    private Optional<Double> envDouble(String key) {
        String value = environment.get(key);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(value.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<Integer> parseInt(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static List<String> csv(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return cleanList(Arrays.asList(value.split(",")));
    }

    private static List<String> cleanList(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .toList();
    }
}
