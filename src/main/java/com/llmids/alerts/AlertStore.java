package com.llmids.alerts;

import java.util.List;
import java.util.Optional;

/**
 * Append-only alert persistence with a uniqueness guarantee on the dedupe key.
 */
public interface AlertStore {

    /**
     * Atomically inserts the alert unless one with the same dedupe key exists. Returns the stored
     * alert with its assigned id, or empty when the key was already taken.
     */
    Optional<Alert> insertIfAbsent(Alert alert);

    /**
     * Matching alerts, newest first, capped at the query limit.
     */
    List<Alert> findActive(AlertQuery query);

    List<Alert> listRecent(int limit);

    List<Alert> findBySession(String sessionId);

    /**
     * Removes every alert. Development use only.
     */
    void clear();
}
