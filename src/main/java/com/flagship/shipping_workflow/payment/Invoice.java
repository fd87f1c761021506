package com.flagship.shipping_workflow.payment;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Provider invoice the user pays through {@code paymentUrl}.
 */
@Value
public class Invoice {

    @JsonProperty("external_reference")
    String externalReference;

    @JsonProperty("payment_url")
    String paymentUrl;
}
