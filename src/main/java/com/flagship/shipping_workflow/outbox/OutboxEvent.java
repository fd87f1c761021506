package com.flagship.shipping_workflow.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A completion request parked in {@code outbox_events} until the publisher
 * hands it to Kafka.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Order" or "BalanceTopUp"
    UUID aggregateId;
    String eventType;
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;       // BIGSERIAL, null before insert

    static OutboxEvent pending(String aggregateType, UUID aggregateId, String eventType,
                               String payload, Instant now) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType, payload,
                now, null, 0, null, null);
    }

    /**
     * Kafka key. Requests for one order or top-up land on one partition.
     */
    public String partitionKey() {
        return aggregateId.toString();
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLetter(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
