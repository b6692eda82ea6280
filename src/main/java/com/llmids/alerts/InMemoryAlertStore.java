package com.llmids.alerts;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryAlertStore implements AlertStore {
    private static final Comparator<Alert> NEWEST_FIRST = Comparator.comparing(Alert::createdAt)
            .thenComparingLong(Alert::id)
            .reversed();

    private final Map<String, Alert> alertsByKey = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Optional<Alert> insertIfAbsent(Alert alert) {
        AtomicBoolean created = new AtomicBoolean(false);
        Alert stored = alertsByKey.computeIfAbsent(alert.dedupeKey(), key -> {
            created.set(true);
            return alert.withId(sequence.incrementAndGet());
        });
        return created.get() ? Optional.of(stored) : Optional.empty();
    }

    @Override
    public List<Alert> findActive(AlertQuery query) {
        return alertsByKey.values().stream()
                .filter(query::matches)
                .sorted(NEWEST_FIRST)
                .limit(query.limit())
                .toList();
    }

    @Override
    public List<Alert> listRecent(int limit) {
        return alertsByKey.values().stream()
                .sorted(NEWEST_FIRST)
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public List<Alert> findBySession(String sessionId) {
        return alertsByKey.values().stream()
                .filter(alert -> alert.sessionId().equals(sessionId))
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public void clear() {
        alertsByKey.clear();
    }
}
