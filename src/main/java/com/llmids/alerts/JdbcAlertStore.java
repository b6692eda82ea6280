package com.llmids.alerts;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.llmids.scoring.Severity;

/**
 * Alert store on an embedded H2 database. Duplicate suppression relies on the unique constraint on
 * {@code dedupe_key}: a single insert either lands or is rejected, so concurrent emitters need no
 * application-level lock.
 */
public class JdbcAlertStore implements AlertStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcAlertStore.class);
    private static final String UNIQUE_VIOLATION_STATE = "23505";

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS alerts (
                id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                session_id VARCHAR NOT NULL,
                created_at BIGINT NOT NULL,
                score INT NOT NULL,
                severity VARCHAR(16) NOT NULL,
                confidence DOUBLE PRECISION NOT NULL,
                labels VARCHAR NOT NULL,
                top_reason VARCHAR NOT NULL,
                dedupe_key VARCHAR NOT NULL,
                spike_turn INT,
                spike_delta INT,
                max_user_keyword_delta INT,
                increase_turns VARCHAR NOT NULL,
                timeline_url VARCHAR NOT NULL,
                CONSTRAINT uq_alerts_dedupe_key UNIQUE (dedupe_key)
            )
            """;
    private static final String CREATE_INDEX = "CREATE INDEX IF NOT EXISTS idx_alerts_created_at ON alerts (created_at)";
    private static final String INSERT = """
            INSERT INTO alerts (session_id, created_at, score, severity, confidence, labels, top_reason, dedupe_key,
                                spike_turn, spike_delta, max_user_keyword_delta, increase_turns, timeline_url)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
    private static final String SELECT_COLUMNS = """
            SELECT id, session_id, created_at, score, severity, confidence, labels, top_reason, dedupe_key,
                   spike_turn, spike_delta, max_user_keyword_delta, increase_turns, timeline_url
            FROM alerts
            """;
    private static final String NEWEST_FIRST = " ORDER BY created_at DESC, id DESC";

    private final String jdbcUrl;

    public JdbcAlertStore(String jdbcUrl) {
        this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        initSchema();
    }

    public static JdbcAlertStore file(Path databasePath) {
        return new JdbcAlertStore("jdbc:h2:file:" + databasePath.toAbsolutePath() + ";LOCK_TIMEOUT=10000");
    }

    public static JdbcAlertStore inMemory(String name) {
        return new JdbcAlertStore("jdbc:h2:mem:" + name + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
    }

    private void initSchema() {
        try (Connection connection = connect(); Statement statement = connection.createStatement()) {
            statement.execute(CREATE_TABLE);
            statement.execute(CREATE_INDEX);
            log.info("Alert store ready at {}", jdbcUrl);
        } catch (SQLException e) {
            throw new AlertStoreException("Unable to initialize alert schema at " + jdbcUrl, e);
        }
    }

    @Override
    public Optional<Alert> insertIfAbsent(Alert alert) {
        try (Connection connection = connect();
                PreparedStatement insert = connection.prepareStatement(INSERT, Statement.RETURN_GENERATED_KEYS)) {
            AlertEnrichment enrichment = alert.enrichment();
            insert.setString(1, alert.sessionId());
            insert.setLong(2, alert.createdAt().toEpochMilli());
            insert.setInt(3, alert.score());
            insert.setString(4, alert.severity().name());
            insert.setDouble(5, alert.confidence());
            insert.setString(6, String.join(",", alert.labels()));
            insert.setString(7, alert.topReason());
            insert.setString(8, alert.dedupeKey());
            setNullableInt(insert, 9, enrichment.spikeTurn());
            setNullableInt(insert, 10, enrichment.spikeDelta());
            setNullableInt(insert, 11, enrichment.maxUserKeywordDelta());
            insert.setString(12, enrichment.increaseTurns().stream().map(String::valueOf).collect(Collectors.joining(",")));
            insert.setString(13, alert.timelineUrl());
            insert.executeUpdate();

            long id = 0L;
            try (ResultSet keys = insert.getGeneratedKeys()) {
                if (keys.next()) {
                    id = keys.getLong(1);
                }
            }
            return Optional.of(alert.withId(id));
        } catch (SQLIntegrityConstraintViolationException e) {
            log.debug("Alert already recorded for dedupeKey={}", alert.dedupeKey());
            return Optional.empty();
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION_STATE.equals(e.getSQLState())) {
                log.debug("Alert already recorded for dedupeKey={}", alert.dedupeKey());
                return Optional.empty();
            }
            throw new AlertStoreException("Unable to insert alert " + alert.dedupeKey(), e);
        }
    }

    @Override
    public List<Alert> findActive(AlertQuery query) {
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS).append(" WHERE created_at >= ?");
        if (query.minScore() != null) {
            sql.append(" AND score >= ?");
        }
        if (query.severity() != null) {
            sql.append(" AND severity = ?");
        }
        sql.append(NEWEST_FIRST);

        try (Connection connection = connect(); PreparedStatement select = connection.prepareStatement(sql.toString())) {
            int index = 1;
            select.setLong(index++, query.cutoff().toEpochMilli());
            if (query.minScore() != null) {
                select.setInt(index++, query.minScore());
            }
            if (query.severity() != null) {
                select.setString(index, query.severity().name());
            }
            return readAll(select).stream()
                    .filter(query::matches)
                    .limit(query.limit())
                    .toList();
        } catch (SQLException e) {
            throw new AlertStoreException("Unable to query active alerts", e);
        }
    }

    @Override
    public List<Alert> listRecent(int limit) {
        try (Connection connection = connect();
                PreparedStatement select = connection.prepareStatement(SELECT_COLUMNS + NEWEST_FIRST + " LIMIT ?")) {
            select.setInt(1, Math.max(0, limit));
            return readAll(select);
        } catch (SQLException e) {
            throw new AlertStoreException("Unable to list alerts", e);
        }
    }

    @Override
    public List<Alert> findBySession(String sessionId) {
        try (Connection connection = connect();
                PreparedStatement select = connection.prepareStatement(SELECT_COLUMNS + " WHERE session_id = ?" + NEWEST_FIRST)) {
            select.setString(1, sessionId);
            return readAll(select);
        } catch (SQLException e) {
            throw new AlertStoreException("Unable to list alerts for session " + sessionId, e);
        }
    }

    @Override
    public void clear() {
        try (Connection connection = connect(); Statement statement = connection.createStatement()) {
            int removed = statement.executeUpdate("DELETE FROM alerts");
            log.info("Cleared {} alerts", removed);
        } catch (SQLException e) {
            throw new AlertStoreException("Unable to clear alerts", e);
        }
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection(jdbcUrl);
    }

    private static List<Alert> readAll(PreparedStatement select) throws SQLException {
        List<Alert> alerts = new ArrayList<>();
        try (ResultSet rows = select.executeQuery()) {
            while (rows.next()) {
                alerts.add(mapRow(rows));
            }
        }
        return alerts;
    }

    private static Alert mapRow(ResultSet row) throws SQLException {
        AlertEnrichment enrichment = new AlertEnrichment(
                nullableInt(row, "spike_turn"),
                nullableInt(row, "spike_delta"),
                nullableInt(row, "max_user_keyword_delta"),
                splitCsv(row.getString("increase_turns")).stream().map(Integer::valueOf).toList());
        return new Alert(
                row.getLong("id"),
                row.getString("session_id"),
                Instant.ofEpochMilli(row.getLong("created_at")),
                row.getInt("score"),
                Severity.parse(row.getString("severity")).orElse(Severity.NONE),
                row.getDouble("confidence"),
                splitCsv(row.getString("labels")),
                row.getString("top_reason"),
                row.getString("dedupe_key"),
                enrichment,
                row.getString("timeline_url"));
    }

    private static List<String> splitCsv(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(part -> !part.isEmpty())
                .toList();
    }

    private static Integer nullableInt(ResultSet row, String column) throws SQLException {
        int value = row.getInt(column);
        return row.wasNull() ? null : value;
    }

    private static void setNullableInt(PreparedStatement statement, int index, Integer value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setInt(index, value);
        }
    }
}
