package com.llmids;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.llmids.alerts.AlertStore;
import com.llmids.alerts.AlertStoreException;
import com.llmids.alerts.InMemoryAlertStore;
import com.llmids.alerts.JdbcAlertStore;
import com.llmids.event.Event;
import com.llmids.event.SessionIds;
import com.llmids.runtime.AppConfig;
import com.llmids.runtime.DetectionPipeline;
import com.llmids.runtime.DetectionSettings;
import com.llmids.runtime.DetectionSettingsResolver;
import com.llmids.runtime.JsonSupport;
import com.llmids.scoring.Severity;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
        name = "llm-ids",
        mixinStandardHelpOptions = true,
        version = "llm-ids 0.5.0",
        description = "Scores LLM conversations for drift and intrusion signals.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Spec
    CommandSpec spec;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "score")
    Mode mode;

    @Option(names = "--events", description = "JSONL file with one conversation event per line")
    Path eventsPath;

    @Option(names = "--session", description = "Session id; filters events and keys alerts")
    String sessionId;

    @Option(names = "--db-path", description = "H2 alert database path (overrides alerts.databasePath)")
    Path dbPath;

    @Option(names = "--window-seconds", description = "Active alert window in seconds")
    Long windowSeconds;

    @Option(names = "--min-score", description = "Minimum alert score for active mode")
    Integer minScore;

    @Option(names = "--label", description = "Only alerts carrying this label")
    String label;

    @Option(names = "--severity", description = "Only alerts with this severity: ${COMPLETION-CANDIDATES}")
    Severity severity;

    @Option(names = "--limit", description = "Maximum number of alerts to print")
    Integer limit;

    @Option(names = "--no-events", description = "Omit raw events from timeline output", defaultValue = "false")
    boolean omitEvents;

    @Option(names = "--truncate", description = "Timeline event content limit in characters", defaultValue = "240")
    int truncate;

    enum Mode {
        score,
        route,
        evaluate,
        timeline,
        alerts,
        active,
        reset,
        config
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        AppConfig config;
        try {
            config = JsonSupport.loadConfig(Path.of(configPath));
        } catch (IOException e) {
            log.error("Unable to read config {}", configPath, e);
            return 1;
        }
        DetectionSettings settings = new DetectionSettingsResolver().resolve(config);
        log.info("Starting llm-ids in {} mode", mode);

        try {
            switch (mode) {
                case config -> out.println(JsonSupport.pretty(settings));
                case score -> {
                    List<Event> events = loadEvents();
                    if (events == null) {
                        return 2;
                    }
                    out.println(JsonSupport.pretty(pipeline(settings, null).score(events)));
                }
                case route -> {
                    List<Event> events = loadEvents();
                    if (events == null) {
                        return 2;
                    }
                    out.println(JsonSupport.pretty(pipeline(settings, null).route(resolveSession(events), events)));
                }
                case timeline -> {
                    List<Event> events = loadEvents();
                    if (events == null) {
                        return 2;
                    }
                    out.println(JsonSupport.pretty(pipeline(settings, null).timeline(events, !omitEvents, truncate)));
                }
                case evaluate -> {
                    List<Event> events = loadEvents();
                    if (events == null) {
                        return 2;
                    }
                    DetectionPipeline pipeline = pipeline(settings, openStore(config));
                    out.println(JsonSupport.pretty(pipeline.evaluate(resolveSession(events), events)));
                }
                case alerts -> {
                    DetectionPipeline pipeline = pipeline(settings, openStore(config));
                    Object alerts = sessionId == null
                            ? pipeline.alerts().recentAlerts(limit == null ? settings.alerts().activeLimit() : limit)
                            : pipeline.alerts().alertsForSession(SessionIds.normalize(sessionId));
                    out.println(JsonSupport.pretty(alerts));
                }
                case active -> {
                    DetectionPipeline pipeline = pipeline(settings, openStore(config));
                    Duration window = windowSeconds == null || windowSeconds <= 0
                            ? settings.alerts().activeWindow()
                            : Duration.ofSeconds(windowSeconds);
                    int max = limit == null || limit <= 0 ? settings.alerts().activeLimit() : limit;
                    out.println(JsonSupport.pretty(pipeline.alerts().activeAlerts(window, minScore, label, severity, max)));
                }
                case reset -> {
                    openStore(config).clear();
                    out.println("Alert store cleared.");
                }
                default -> throw new IllegalStateException("Unhandled mode " + mode);
            }
        } catch (IOException | AlertStoreException e) {
            log.error("{} failed: {}", mode, e.getMessage(), e);
            return 1;
        }
        out.flush();
        return 0;
    }

    private List<Event> loadEvents() throws IOException {
        if (eventsPath == null) {
            log.error("--events is required in {} mode", mode);
            return null;
        }
        List<Event> events = JsonSupport.readEvents(eventsPath);
        if (sessionId == null) {
            return events;
        }
        String wanted = SessionIds.normalize(sessionId);
        return events.stream()
                .filter(event -> SessionIds.normalize(event.sessionId()).equals(wanted))
                .toList();
    }

    private String resolveSession(List<Event> events) {
        if (sessionId != null) {
            return SessionIds.normalize(sessionId);
        }
        return events.isEmpty() ? SessionIds.DEFAULT_SESSION : SessionIds.normalize(events.get(0).sessionId());
    }

    private AlertStore openStore(AppConfig config) {
        Path path = dbPath != null ? dbPath : Path.of(config.getAlerts().getDatabasePath());
        return JdbcAlertStore.file(path);
    }

    private static DetectionPipeline pipeline(DetectionSettings settings, AlertStore store) {
        return new DetectionPipeline(settings, store == null ? new InMemoryAlertStore() : store);
    }
}
