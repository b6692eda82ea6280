package com.llmids.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.llmids.event.Event;

public final class JsonSupport {
    private static final ObjectMapper JSON = JsonMapper.builder()
            .findAndAddModules()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .build();

    private JsonSupport() {
    }

    public static ObjectMapper json() {
        return JSON;
    }

    /**
     * Returns defaults when the file does not exist.
     */
    public static AppConfig loadConfig(Path config) throws IOException {
        if (config == null || !Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig loaded = mapper.readValue(config.toFile(), AppConfig.class);
        return loaded == null ? new AppConfig() : loaded;
    }

    /**
     * Reads one event per non-blank line.
     */
    public static List<Event> readEvents(Path jsonl) throws IOException {
        List<Event> events = new ArrayList<>();
        int lineNumber = 0;
        for (String line : Files.readAllLines(jsonl)) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                events.add(JSON.readValue(line, Event.class));
            } catch (IOException e) {
                throw new IOException("Invalid event at " + jsonl + ":" + lineNumber + ": " + e.getMessage(), e);
            }
        }
        return events;
    }

    public static String pretty(Object value) throws IOException {
        return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    }
}
