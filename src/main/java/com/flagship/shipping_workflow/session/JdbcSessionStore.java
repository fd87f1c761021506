package com.flagship.shipping_workflow.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.shipping_workflow.config.WorkflowProperties;
import com.flagship.shipping_workflow.workflow.WorkflowStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL-backed session store.
 *
 * Atomicity comes from single statements rather than read-modify-write:
 * - creation is an {@code INSERT ... ON CONFLICT (user_key) DO UPDATE}
 * - field patches use {@code fields = fields || ?::jsonb}, so keys outside the
 *   patch are never overwritten by a concurrent writer
 * - every statement filters on {@code last_touched_at}, which makes an expired
 *   row invisible before the sweeper removes it
 *
 * Uses JdbcTemplate like the balance service because the statements rely on
 * PostgreSQL-specific upsert and jsonb operators.
 */
@Component
@ConditionalOnProperty(name = "workflow.session.store", havingValue = "jdbc", matchIfMissing = true)
@Slf4j
public class JdbcSessionStore implements SessionStore {

    private static final String COLUMNS =
            "user_key, order_correlation_id, current_step, fields, created_at, last_touched_at";

    private static final TypeReference<Map<String, String>> FIELD_MAP = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final FinalizationStrategy finalizationStrategy;
    private final Clock clock;
    private final Duration ttl;

    private final RowMapper<Session> sessionRowMapper = this::mapSession;

    public JdbcSessionStore(JdbcTemplate jdbcTemplate,
                            ObjectMapper objectMapper,
                            FinalizationStrategy finalizationStrategy,
                            Clock clock,
                            WorkflowProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.finalizationStrategy = finalizationStrategy;
        this.clock = clock;
        this.ttl = properties.getSession().getTtl();
    }

    @Override
    @Transactional
    public Session getOrCreate(String userKey, FieldPatch initialFields) {
        Instant now = clock.instant();

        int stale = jdbcTemplate.update(
                "DELETE FROM user_sessions WHERE user_key = ? AND last_touched_at <= ?",
                userKey, Timestamp.from(cutoff(now)));
        if (stale > 0) {
            log.info("Discarded expired session before re-creating: userKey={}", userKey);
        }

        String sql = "INSERT INTO user_sessions (" + COLUMNS + ") " +
                "VALUES (?, ?, ?, ?::jsonb, ?, ?) " +
                "ON CONFLICT (user_key) DO UPDATE SET last_touched_at = EXCLUDED.last_touched_at " +
                "RETURNING " + COLUMNS;

        List<Session> rows = jdbcTemplate.query(sql, sessionRowMapper,
                userKey,
                OrderCorrelationIds.generate(now),
                WorkflowStep.START.name(),
                toJson(initialFields.toStorageMap()),
                Timestamp.from(now),
                Timestamp.from(now));

        Session session = rows.get(0);
        log.debug("Session ready: userKey={}, step={}, orderCorrelationId={}",
                userKey, session.getCurrentStep(), session.getOrderCorrelationId());
        return session;
    }

    @Override
    public Optional<Session> updateAtomic(String userKey, WorkflowStep step, FieldPatch patch) {
        Instant now = clock.instant();

        String sql = "UPDATE user_sessions " +
                "SET fields = fields || ?::jsonb, " +
                "    current_step = COALESCE(CAST(? AS VARCHAR), current_step), " +
                "    last_touched_at = ? " +
                "WHERE user_key = ? AND last_touched_at > ? " +
                "RETURNING " + COLUMNS;

        List<Session> rows = jdbcTemplate.query(sql, sessionRowMapper,
                toJson(patch.toStorageMap()),
                step != null ? step.name() : null,
                Timestamp.from(now),
                userKey,
                Timestamp.from(cutoff(now)));

        if (rows.isEmpty()) {
            log.debug("Update found no live session: userKey={}", userKey);
            return Optional.empty();
        }
        return Optional.of(rows.get(0));
    }

    @Override
    public Optional<Session> get(String userKey) {
        List<Session> rows = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM user_sessions WHERE user_key = ? AND last_touched_at > ?",
                sessionRowMapper,
                userKey, Timestamp.from(cutoff(clock.instant())));
        return rows.stream().findFirst();
    }

    @Override
    public void clear(String userKey) {
        int deleted = jdbcTemplate.update("DELETE FROM user_sessions WHERE user_key = ?", userKey);
        log.debug("Session cleared: userKey={}, existed={}", userKey, deleted > 0);
    }

    @Override
    public void finalizeAndArchive(String userKey, CompletionRecord record) {
        finalizationStrategy.finalizeSession(userKey,
                () -> insertArchive(record),
                () -> clear(userKey));
        log.info("Session archived: userKey={}, orderCorrelationId={}, atomic={}",
                userKey, record.getOrderCorrelationId(), finalizationStrategy.isAtomic());
    }

    @Override
    public int purgeExpired() {
        return jdbcTemplate.update(
                "DELETE FROM user_sessions WHERE last_touched_at <= ?",
                Timestamp.from(cutoff(clock.instant())));
    }

    private void insertArchive(CompletionRecord record) {
        jdbcTemplate.update(
                "INSERT INTO completed_sessions " +
                "(id, user_key, order_correlation_id, order_id, fields, completed_at) " +
                "VALUES (?, ?, ?, ?, ?::jsonb, ?)",
                record.getId(),
                record.getUserKey(),
                record.getOrderCorrelationId(),
                record.getOrderId(),
                toJson(record.getFields()),
                Timestamp.from(record.getCompletedAt()));
    }

    private Instant cutoff(Instant now) {
        return now.minus(ttl);
    }

    private Session mapSession(ResultSet rs, int rowNum) throws SQLException {
        return new Session(
                rs.getString("user_key"),
                rs.getString("order_correlation_id"),
                WorkflowStep.valueOf(rs.getString("current_step")),
                fromJson(rs.getString("fields")),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("last_touched_at").toInstant());
    }

    private String toJson(Map<String, String> fields) {
        try {
            return objectMapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize session fields", e);
        }
    }

    private Map<SessionField, String> fromJson(String json) {
        Map<SessionField, String> fields = new EnumMap<>(SessionField.class);
        if (json == null || json.isBlank()) {
            return fields;
        }
        try {
            Map<String, String> raw = objectMapper.readValue(json, FIELD_MAP);
            raw.forEach((key, value) -> SessionField.fromKey(key).ifPresentOrElse(
                    field -> fields.put(field, value),
                    () -> log.warn("Ignoring unknown session field: key={}", key)));
            return fields;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt session fields: " + e.getOriginalMessage(), e);
        }
    }
}
