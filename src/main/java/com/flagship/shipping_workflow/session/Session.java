package com.flagship.shipping_workflow.session;

import com.flagship.shipping_workflow.workflow.WorkflowStep;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Domain model for a user's in-progress workflow.
 *
 * At most one live session exists per user key. A session is live while
 * {@code lastTouchedAt + ttl} lies in the future; every mutation refreshes
 * {@code lastTouchedAt}.
 *
 * Field values may be {@code null}: that means the user explicitly skipped
 * the field, as opposed to a field that was never written.
 */
@Value
public class Session {
    String userKey;
    String orderCorrelationId;
    WorkflowStep currentStep;
    Map<SessionField, String> fields;
    Instant createdAt;
    Instant lastTouchedAt;

    public Session(String userKey, String orderCorrelationId, WorkflowStep currentStep,
                   Map<SessionField, String> fields, Instant createdAt, Instant lastTouchedAt) {
        this.userKey = userKey;
        this.orderCorrelationId = orderCorrelationId;
        this.currentStep = currentStep;
        EnumMap<SessionField, String> copy = new EnumMap<>(SessionField.class);
        copy.putAll(fields);
        this.fields = Collections.unmodifiableMap(copy);
        this.createdAt = createdAt;
        this.lastTouchedAt = lastTouchedAt;
    }

    /**
     * Creates a fresh session at START.
     */
    public static Session start(String userKey, String orderCorrelationId, FieldPatch initialFields, Instant now) {
        return new Session(userKey, orderCorrelationId, WorkflowStep.START,
                initialFields.asMap(), now, now);
    }

    public boolean isExpired(Instant now, Duration ttl) {
        return !lastTouchedAt.plus(ttl).isAfter(now);
    }

    public boolean has(SessionField field) {
        return fields.containsKey(field);
    }

    public Optional<String> field(SessionField field) {
        return Optional.ofNullable(fields.get(field));
    }

    /**
     * Applies a patch and an optional step change, returning the new state.
     */
    public Session apply(WorkflowStep step, FieldPatch patch, Instant now) {
        EnumMap<SessionField, String> merged = new EnumMap<>(SessionField.class);
        merged.putAll(fields);
        merged.putAll(patch.asMap());
        return new Session(userKey, orderCorrelationId, step != null ? step : currentStep,
                merged, createdAt, now);
    }

    public Session touch(Instant now) {
        return new Session(userKey, orderCorrelationId, currentStep, fields, createdAt, now);
    }
}
