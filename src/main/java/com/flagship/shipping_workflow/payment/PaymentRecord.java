package com.flagship.shipping_workflow.payment;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Domain model for a payment awaiting or having received provider confirmation.
 *
 * {@code externalReference} is the provider's invoice id and is unique.
 */
@Value
@Builder(toBuilder = true)
public class PaymentRecord {
    UUID id;
    String externalReference;
    String userKey;
    PaymentKind kind;
    BigDecimal requestedAmount;
    BigDecimal paidAmount;
    PaymentStatus status;
    String orderCorrelationId;   // only for ORDER_PAYMENT
    String paymentUrl;
    Instant createdAt;
    Instant updatedAt;

    public static PaymentRecord pending(String userKey, PaymentKind kind, BigDecimal requestedAmount,
                                        String orderCorrelationId, Invoice invoice, Instant now) {
        return PaymentRecord.builder()
                .id(UUID.randomUUID())
                .externalReference(invoice.getExternalReference())
                .userKey(userKey)
                .kind(kind)
                .requestedAmount(requestedAmount)
                .status(PaymentStatus.PENDING)
                .orderCorrelationId(orderCorrelationId)
                .paymentUrl(invoice.getPaymentUrl())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public boolean isPaid() {
        return status == PaymentStatus.PAID;
    }
}
