package com.flagship.shipping_workflow.payment;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * What a completion trigger needs to know about a settled payment.
 */
@Value
public class CompletionRequest {
    UUID orderId;                // null for balance top-ups
    String orderCorrelationId;   // null for balance top-ups
    String userKey;
    PaymentKind kind;
    String externalReference;
    BigDecimal amount;
}
