package com.llmids.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.llmids.features.FeatureConfig;
import com.llmids.routing.RouterPolicy;
import com.llmids.rules.WeaponInstructionRule;
import com.llmids.scoring.ScoringConfig;
import com.llmids.scoring.Severity;
import com.llmids.scoring.SeverityBand;

class DetectionSettingsResolverTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldResolveBuiltInDefaults() {
        DetectionSettings settings = new DetectionSettingsResolver(Map.of()).resolve(new AppConfig());

        assertEquals(DetectionSettings.defaults(), settings);
    }

    @Test
    void shouldResolveShippedConfigToBuiltInDefaults() throws IOException {
        AppConfig config = JsonSupport.loadConfig(Path.of("src/main/resources/application.yml"));

        assertEquals(DetectionSettings.defaults(), new DetectionSettingsResolver(Map.of()).resolve(config));
    }

    @Test
    void shouldApplyEnvironmentOverShippedConfig() throws IOException {
        AppConfig config = JsonSupport.loadConfig(Path.of("src/main/resources/application.yml"));
        Map<String, String> env = Map.of(
                "IDS_ROUTE_BLOCK_SCORE", "50",
                "IDS_ROUTE_REVIEW_SCORE", "20",
                "IDS_ROUTE_BLOCK_LABELS", "drug_synthesis",
                "IDS_ALERT_THRESHOLD", "10",
                "REFUSAL_SIM_THRESHOLD", "0.9",
                "REFUSAL_WINDOW_TURNS", "4",
                "IDS_CRESCENDO_KEYWORDS", "payload");

        DetectionSettings settings = new DetectionSettingsResolver(env).resolve(config);

        assertEquals(50, settings.router().blockScore());
        assertEquals(20, settings.router().reviewScore());
        assertEquals(Set.of("DRUG_SYNTHESIS"), settings.router().blockLabels());
        assertEquals(10, settings.alerts().scoreThreshold());
        assertEquals(new FeatureConfig(List.of("payload"), 0.9, 4), settings.features());
        assertEquals(Duration.ofHours(1), settings.alerts().activeWindow());
    }

    @Test
    void shouldReadEnvironmentFallbacks() {
        Map<String, String> env = Map.of(
                "IDS_WEIGHT_WEAPON_INSTRUCTION", "12",
                "IDS_WEIGHT_BROKEN", "abc",
                "IDS_CRESCENDO_KEYWORDS", "alpha, beta ,,",
                "REFUSAL_SIM_THRESHOLD", "0.5",
                "REFUSAL_WINDOW_TURNS", "3",
                "IDS_ROUTE_BLOCK_SCORE", "70",
                "IDS_ROUTE_REVIEW_LABELS", "crescendo_attack, risk_velocity",
                "IDS_ALERT_THRESHOLD", "60");

        DetectionSettings settings = new DetectionSettingsResolver(env).resolve(new AppConfig());

        assertEquals(new FeatureConfig(List.of("alpha", "beta"), 0.5, 3), settings.features());
        assertEquals(Map.of("WEAPON_INSTRUCTION", 12), settings.scoring().fallbackWeights());
        assertEquals(12, settings.scoring().weightFor(new WeaponInstructionRule()));
        assertEquals(70, settings.router().blockScore());
        assertEquals(Set.of("CRESCENDO_ATTACK", "RISK_VELOCITY"), settings.router().reviewLabels());
        assertEquals(RouterPolicy.DEFAULT_BLOCK_LABELS, settings.router().blockLabels());
        assertEquals(60, settings.alerts().scoreThreshold());
    }

    @Test
    void shouldPreferYamlValuesOverEnvironment() throws IOException {
        Path file = tempDir.resolve("ids.yml");
        Files.writeString(file, """
                scoring:
                  weights:
                    weapon_instruction: 5
                router:
                  blockScore: 90
                alerts:
                  scoreThreshold: 75
                  activeWindowSeconds: 600
                unknownSection:
                  ignored: true
                """);
        Map<String, String> env = Map.of(
                "IDS_WEIGHT_WEAPON_INSTRUCTION", "12",
                "IDS_ROUTE_BLOCK_SCORE", "70",
                "IDS_ALERT_THRESHOLD", "60");

        DetectionSettings settings = new DetectionSettingsResolver(env).resolve(JsonSupport.loadConfig(file));

        assertEquals(5, settings.scoring().weightFor(new WeaponInstructionRule()));
        assertEquals(90, settings.router().blockScore());
        assertEquals(75, settings.alerts().scoreThreshold());
        assertEquals(Duration.ofMinutes(10), settings.alerts().activeWindow());
    }

    @Test
    void shouldFallBackOnInvalidValues() {
        AppConfig config = new AppConfig();
        config.getScoring().setCap(-5);
        config.getScoring().setMaxTheoreticalScore(0);
        config.getScoring().setSeverityBands(List.of(
                new AppConfig.BandConfig("bogus", 10),
                new AppConfig.BandConfig("HIGH", null)));
        config.getFeatures().setRephraseSimilarityThreshold(1.5);
        config.getRules().setVelocityMinSpikes(0);
        config.getAlerts().setActiveWindowSeconds(-1L);
        Map<String, String> env = Map.of(
                "REFUSAL_WINDOW_TURNS", "x",
                "IDS_ROUTE_REVIEW_SCORE", "-3");

        DetectionSettings settings = new DetectionSettingsResolver(env).resolve(config);

        assertEquals(ScoringConfig.DEFAULT_CAP, settings.scoring().cap());
        assertEquals(ScoringConfig.DEFAULT_MAX_THEORETICAL_SCORE, settings.scoring().maxTheoreticalScore());
        assertEquals(ScoringConfig.DEFAULT_BANDS, settings.scoring().severityBands());
        assertEquals(FeatureConfig.defaults(), settings.features());
        assertEquals(2, settings.rules().velocityMinSpikes());
        assertEquals(RouterPolicy.DEFAULT_REVIEW_SCORE, settings.router().reviewScore());
        assertEquals(Duration.ofHours(1), settings.alerts().activeWindow());
    }

    @Test
    void shouldAcceptMediumAliasInBands() {
        AppConfig config = new AppConfig();
        config.getScoring().setSeverityBands(List.of(
                new AppConfig.BandConfig("MEDIUM", 30),
                new AppConfig.BandConfig("none", 0)));

        DetectionSettings settings = new DetectionSettingsResolver(Map.of()).resolve(config);

        assertEquals(List.of(new SeverityBand(0, Severity.NONE), new SeverityBand(30, Severity.MED)),
                settings.scoring().severityBands());
        assertEquals(Severity.MED, settings.scoring().severityFor(45));
    }

    @Test
    void shouldYieldDefaultsForMissingConfigFile() throws IOException {
        AppConfig config = JsonSupport.loadConfig(tempDir.resolve("absent.yml"));

        assertEquals(DetectionSettings.defaults(), new DetectionSettingsResolver(Map.of()).resolve(config));
    }
}
