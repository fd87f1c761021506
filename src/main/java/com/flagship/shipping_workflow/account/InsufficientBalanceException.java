package com.flagship.shipping_workflow.account;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Raised when a balance payment exceeds the available funds.
 */
@Getter
public class InsufficientBalanceException extends RuntimeException {

    private final String userKey;
    private final BigDecimal available;
    private final BigDecimal required;

    public InsufficientBalanceException(String userKey, BigDecimal available, BigDecimal required) {
        super(String.format("Insufficient balance for %s: available %s, required %s",
                userKey, available.toPlainString(), required.toPlainString()));
        this.userKey = userKey;
        this.available = available;
        this.required = required;
    }
}
