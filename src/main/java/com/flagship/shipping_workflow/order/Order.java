package com.flagship.shipping_workflow.order;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Domain model for a placed shipment order.
 *
 * Created once per session hand-off; {@code orderCorrelationId} is the
 * session's and is unique, which makes placement idempotent.
 */
@Value
@Builder(toBuilder = true)
public class Order {
    UUID id;
    String orderCorrelationId;
    String userKey;
    PaymentMethod paymentMethod;
    OrderPaymentStatus paymentStatus;
    String quoteId;
    String carrier;
    String service;
    BigDecimal amount;
    String shipment;          // JSON snapshot of the collected shipment details
    Instant createdAt;
    Instant updatedAt;

    public boolean isPaid() {
        return paymentStatus == OrderPaymentStatus.PAID;
    }
}
