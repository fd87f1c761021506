package com.flagship.shipping_workflow.payment;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Payment-status notification from the provider, as received by the webhook
 * or the Kafka consumer. May be delivered more than once.
 */
@Value
public class PaymentEvent {

    @JsonProperty("external_reference")
    String externalReference;

    @JsonProperty("status")
    String status;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("kind")
    PaymentKind kind;

    @JsonProperty("order_correlation_id")
    String orderCorrelationId;
}
