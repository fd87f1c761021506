package com.flagship.shipping_workflow.session;

import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Archived snapshot of a session that was handed off to an order.
 */
@Value
public class CompletionRecord {
    UUID id;
    String userKey;
    String orderCorrelationId;
    UUID orderId;
    Map<String, String> fields;   // storage keys, nulls preserved
    Instant completedAt;

    public static CompletionRecord of(Session session, UUID orderId, Instant completedAt) {
        return new CompletionRecord(
            UUID.randomUUID(),
            session.getUserKey(),
            session.getOrderCorrelationId(),
            orderId,
            toStorageMap(session),
            completedAt
        );
    }

    private static Map<String, String> toStorageMap(Session session) {
        Map<String, String> storage = new LinkedHashMap<>();
        session.getFields().forEach((field, value) -> storage.put(field.getKey(), value));
        return storage;
    }
}
