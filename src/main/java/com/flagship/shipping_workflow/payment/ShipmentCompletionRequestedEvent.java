package com.flagship.shipping_workflow.payment;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Outbox payload asking downstream services to complete a paid request.
 */
@Value
public class ShipmentCompletionRequestedEvent {

    public static final String EVENT_TYPE = "ShipmentCompletionRequested";

    @JsonProperty("event_id")
    UUID eventId;

    @JsonProperty("event_type")
    String eventType;

    @JsonProperty("kind")
    PaymentKind kind;

    @JsonProperty("user_key")
    String userKey;

    @JsonProperty("order_id")
    UUID orderId;

    @JsonProperty("order_correlation_id")
    String orderCorrelationId;

    @JsonProperty("external_reference")
    String externalReference;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("occurred_at")
    Instant occurredAt;

    public static ShipmentCompletionRequestedEvent from(CompletionRequest request, Instant now) {
        return new ShipmentCompletionRequestedEvent(UUID.randomUUID(), EVENT_TYPE, request.getKind(),
                request.getUserKey(), request.getOrderId(), request.getOrderCorrelationId(),
                request.getExternalReference(), request.getAmount(), now);
    }
}
