package com.flagship.shipping_workflow.quote;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A priced shipping option for one shipment.
 */
@Value
public class Quote {

    @JsonProperty("quote_id")
    String quoteId;

    @JsonProperty("carrier")
    String carrier;

    @JsonProperty("service")
    String service;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("estimated_days")
    Integer estimatedDays;
}
