package com.flagship.shipping_workflow.template;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.shipping_workflow.config.WorkflowProperties;
import com.flagship.shipping_workflow.session.Session;
import com.flagship.shipping_workflow.session.SessionField;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Per-user address templates.
 *
 * A user keeps at most {@code workflow.templates.max-per-user} templates with
 * distinct names. The limit is checked in the insert statement itself.
 */
@Service
@Slf4j
public class TemplateService {

    static final int MAX_NAME_LENGTH = 50;

    private static final Set<SessionField> REQUIRED = EnumSet.of(
            SessionField.FROM_NAME, SessionField.FROM_ADDRESS, SessionField.FROM_CITY,
            SessionField.FROM_STATE, SessionField.FROM_ZIP,
            SessionField.TO_NAME, SessionField.TO_ADDRESS, SessionField.TO_CITY,
            SessionField.TO_STATE, SessionField.TO_ZIP);

    private static final TypeReference<Map<String, String>> FIELD_MAP = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int maxPerUser;

    public TemplateService(JdbcTemplate jdbcTemplate,
                           ObjectMapper objectMapper,
                           Clock clock,
                           WorkflowProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.maxPerUser = properties.getTemplates().getMaxPerUser();
    }

    /**
     * Saves the session's sender and recipient under {@code name}.
     *
     * @throws TemplateRejectedException if the name is unusable, the addresses
     *                                   are incomplete or the limit is reached
     */
    @Transactional
    public AddressTemplate save(String userKey, String name, Session session) {
        String trimmed = name == null ? "" : name.strip();
        if (trimmed.isEmpty()) {
            throw new TemplateRejectedException("Template name cannot be empty");
        }
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new TemplateRejectedException("Template name too long (max " + MAX_NAME_LENGTH + " characters)");
        }
        List<String> missing = REQUIRED.stream()
                .filter(field -> session.field(field).isEmpty())
                .map(SessionField::getKey)
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new TemplateRejectedException("Addresses are incomplete, missing " + missing);
        }

        AddressTemplate template = new AddressTemplate(UUID.randomUUID(), userKey, trimmed,
                session.getFields(), clock.instant());

        int inserted;
        try {
            inserted = jdbcTemplate.update("""
                INSERT INTO address_templates (id, user_key, name, fields, created_at)
                SELECT ?, ?, ?, ?::jsonb, ?
                WHERE (SELECT COUNT(*) FROM address_templates WHERE user_key = ?) < ?
                """,
                template.getId(), userKey, trimmed, toJson(template.getFields()),
                Timestamp.from(template.getCreatedAt()), userKey, maxPerUser);
        } catch (DuplicateKeyException e) {
            throw new TemplateRejectedException("A template named '" + trimmed + "' already exists");
        }
        if (inserted == 0) {
            throw new TemplateRejectedException("Maximum template limit reached (" + maxPerUser + ")");
        }

        log.info("Template saved: id={}, name={}", template.getId(), trimmed);
        return template;
    }

    @Transactional(readOnly = true)
    public List<AddressTemplate> list(String userKey) {
        return jdbcTemplate.query("""
            SELECT id, user_key, name, fields, created_at
            FROM address_templates
            WHERE user_key = ?
            ORDER BY created_at DESC
            LIMIT ?
            """,
            this::mapTemplate, userKey, maxPerUser);
    }

    /**
     * Looks a template up within the user's own templates only.
     */
    @Transactional(readOnly = true)
    public Optional<AddressTemplate> find(String userKey, UUID templateId) {
        List<AddressTemplate> rows = jdbcTemplate.query("""
            SELECT id, user_key, name, fields, created_at
            FROM address_templates
            WHERE id = ? AND user_key = ?
            """,
            this::mapTemplate, templateId, userKey);
        return rows.stream().findFirst();
    }

    @Transactional
    public boolean delete(String userKey, UUID templateId) {
        int deleted = jdbcTemplate.update(
                "DELETE FROM address_templates WHERE id = ? AND user_key = ?", templateId, userKey);
        if (deleted == 1) {
            log.info("Template deleted: id={}", templateId);
        }
        return deleted == 1;
    }

    private AddressTemplate mapTemplate(ResultSet rs, int rowNum) throws SQLException {
        Instant createdAt = rs.getTimestamp("created_at").toInstant();
        return new AddressTemplate(
                rs.getObject("id", UUID.class),
                rs.getString("user_key"),
                rs.getString("name"),
                fromJson(rs.getString("fields")),
                createdAt);
    }

    private String toJson(Map<SessionField, String> fields) {
        Map<String, String> storage = new LinkedHashMap<>();
        fields.forEach((field, value) -> storage.put(field.getKey(), value));
        try {
            return objectMapper.writeValueAsString(storage);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize template fields", e);
        }
    }

    private Map<SessionField, String> fromJson(String json) {
        Map<SessionField, String> fields = new EnumMap<>(SessionField.class);
        try {
            Map<String, String> raw = objectMapper.readValue(json, FIELD_MAP);
            raw.forEach((key, value) -> SessionField.fromKey(key).ifPresent(field -> fields.put(field, value)));
            return fields;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt template fields: " + e.getOriginalMessage(), e);
        }
    }
}
