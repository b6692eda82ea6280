package com.llmids.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * YAML binding for detection settings. Unset values stay null so the resolver can fall back to
 * environment values and then to built-in defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private FeaturesConfig features = new FeaturesConfig();
    private ScoringSection scoring = new ScoringSection();
    private RulesSection rules = new RulesSection();
    private RouterSection router = new RouterSection();
    private AlertsSection alerts = new AlertsSection();

    public FeaturesConfig getFeatures() {
        return features;
    }

    public void setFeatures(FeaturesConfig features) {
        this.features = features == null ? new FeaturesConfig() : features;
    }

    public ScoringSection getScoring() {
        return scoring;
    }

    public void setScoring(ScoringSection scoring) {
        this.scoring = scoring == null ? new ScoringSection() : scoring;
    }

    public RulesSection getRules() {
        return rules;
    }

    public void setRules(RulesSection rules) {
        this.rules = rules == null ? new RulesSection() : rules;
    }

    public RouterSection getRouter() {
        return router;
    }

    public void setRouter(RouterSection router) {
        this.router = router == null ? new RouterSection() : router;
    }

    public AlertsSection getAlerts() {
        return alerts;
    }

    public void setAlerts(AlertsSection alerts) {
        this.alerts = alerts == null ? new AlertsSection() : alerts;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FeaturesConfig {
        private List<String> sensitiveKeywords = new ArrayList<>();
        private Double rephraseSimilarityThreshold;
        private Integer rephraseWindowTurns;

        public List<String> getSensitiveKeywords() {
            return sensitiveKeywords;
        }

        public void setSensitiveKeywords(List<String> sensitiveKeywords) {
            this.sensitiveKeywords = sensitiveKeywords == null ? new ArrayList<>() : sensitiveKeywords;
        }

        public Double getRephraseSimilarityThreshold() {
            return rephraseSimilarityThreshold;
        }

        public void setRephraseSimilarityThreshold(Double rephraseSimilarityThreshold) {
            this.rephraseSimilarityThreshold = rephraseSimilarityThreshold;
        }

        public Integer getRephraseWindowTurns() {
            return rephraseWindowTurns;
        }

        public void setRephraseWindowTurns(Integer rephraseWindowTurns) {
            this.rephraseWindowTurns = rephraseWindowTurns;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ScoringSection {
        private Integer baseline;
        private Integer cap;
        private Integer maxTheoreticalScore;
        private Map<String, Integer> weights = new LinkedHashMap<>();
        private List<BandConfig> severityBands = new ArrayList<>();

        public Integer getBaseline() {
            return baseline;
        }

        public void setBaseline(Integer baseline) {
            this.baseline = baseline;
        }

        public Integer getCap() {
            return cap;
        }

        public void setCap(Integer cap) {
            this.cap = cap;
        }

        public Integer getMaxTheoreticalScore() {
            return maxTheoreticalScore;
        }

        public void setMaxTheoreticalScore(Integer maxTheoreticalScore) {
            this.maxTheoreticalScore = maxTheoreticalScore;
        }

        public Map<String, Integer> getWeights() {
            return weights;
        }

        public void setWeights(Map<String, Integer> weights) {
            this.weights = weights == null ? new LinkedHashMap<>() : weights;
        }

        public List<BandConfig> getSeverityBands() {
            return severityBands;
        }

        public void setSeverityBands(List<BandConfig> severityBands) {
            this.severityBands = severityBands == null ? new ArrayList<>() : severityBands;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BandConfig {
        private String severity;
        private Integer minScore;

        public BandConfig() {
        }

        public BandConfig(String severity, Integer minScore) {
            this.severity = severity;
            this.minScore = minScore;
        }

        public String getSeverity() {
            return severity;
        }

        public void setSeverity(String severity) {
            this.severity = severity;
        }

        public Integer getMinScore() {
            return minScore;
        }

        public void setMinScore(Integer minScore) {
            this.minScore = minScore;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RulesSection {
        private Integer refusalMinRephrases;
        private Integer directAttackMinKeywords;
        private Integer escalationMinTurns;
        private Integer trajectoryMinPhases;
        private Integer velocityMinKeywordDelta;
        private Integer velocityMinSpikes;
        private Integer crescendoMinKeywordDelta;

        public Integer getRefusalMinRephrases() {
            return refusalMinRephrases;
        }

        public void setRefusalMinRephrases(Integer refusalMinRephrases) {
            this.refusalMinRephrases = refusalMinRephrases;
        }

        public Integer getDirectAttackMinKeywords() {
            return directAttackMinKeywords;
        }

        public void setDirectAttackMinKeywords(Integer directAttackMinKeywords) {
            this.directAttackMinKeywords = directAttackMinKeywords;
        }

        public Integer getEscalationMinTurns() {
            return escalationMinTurns;
        }

        public void setEscalationMinTurns(Integer escalationMinTurns) {
            this.escalationMinTurns = escalationMinTurns;
        }

        public Integer getTrajectoryMinPhases() {
            return trajectoryMinPhases;
        }

        public void setTrajectoryMinPhases(Integer trajectoryMinPhases) {
            this.trajectoryMinPhases = trajectoryMinPhases;
        }

        public Integer getVelocityMinKeywordDelta() {
            return velocityMinKeywordDelta;
        }

        public void setVelocityMinKeywordDelta(Integer velocityMinKeywordDelta) {
            this.velocityMinKeywordDelta = velocityMinKeywordDelta;
        }

        public Integer getVelocityMinSpikes() {
            return velocityMinSpikes;
        }

        public void setVelocityMinSpikes(Integer velocityMinSpikes) {
            this.velocityMinSpikes = velocityMinSpikes;
        }

        public Integer getCrescendoMinKeywordDelta() {
            return crescendoMinKeywordDelta;
        }

        public void setCrescendoMinKeywordDelta(Integer crescendoMinKeywordDelta) {
            this.crescendoMinKeywordDelta = crescendoMinKeywordDelta;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RouterSection {
        private Integer blockScore;
        private Integer reviewScore;
        private List<String> blockLabels;
        private List<String> reviewLabels;

        public Integer getBlockScore() {
            return blockScore;
        }

        public void setBlockScore(Integer blockScore) {
            this.blockScore = blockScore;
        }

        public Integer getReviewScore() {
            return reviewScore;
        }

        public void setReviewScore(Integer reviewScore) {
            this.reviewScore = reviewScore;
        }

        public List<String> getBlockLabels() {
            return blockLabels;
        }

        public void setBlockLabels(List<String> blockLabels) {
            this.blockLabels = blockLabels;
        }

        public List<String> getReviewLabels() {
            return reviewLabels;
        }

        public void setReviewLabels(List<String> reviewLabels) {
            this.reviewLabels = reviewLabels;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AlertsSection {
        private Integer scoreThreshold;
        private Long activeWindowSeconds;
        private Integer activeLimit;
        private String databasePath = ".llmids/alerts";

        public Integer getScoreThreshold() {
            return scoreThreshold;
        }

        public void setScoreThreshold(Integer scoreThreshold) {
            this.scoreThreshold = scoreThreshold;
        }

        public Long getActiveWindowSeconds() {
            return activeWindowSeconds;
        }

        public void setActiveWindowSeconds(Long activeWindowSeconds) {
            this.activeWindowSeconds = activeWindowSeconds;
        }

        public Integer getActiveLimit() {
            return activeLimit;
        }

        public void setActiveLimit(Integer activeLimit) {
            this.activeLimit = activeLimit;
        }

        public String getDatabasePath() {
            return databasePath;
        }

        public void setDatabasePath(String databasePath) {
            this.databasePath = databasePath == null ? ".llmids/alerts" : databasePath;
        }
    }
}
