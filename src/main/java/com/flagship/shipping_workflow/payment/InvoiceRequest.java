package com.flagship.shipping_workflow.payment;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class InvoiceRequest {
    String userKey;
    PaymentKind kind;
    BigDecimal amount;
    String orderCorrelationId;
    String description;
}
