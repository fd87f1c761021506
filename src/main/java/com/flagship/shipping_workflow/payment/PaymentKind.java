package com.flagship.shipping_workflow.payment;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum PaymentKind {
    BALANCE_TOPUP,
    ORDER_PAYMENT;

    /**
     * Reads the provider's {@code balance-topup} / {@code order-payment} as
     * well as the constant names, ignoring case. Unknown kinds read as null;
     * the stored payment record decides the kind anyway.
     */
    @JsonCreator
    public static PaymentKind fromProvider(String raw) {
        if (raw == null) {
            return null;
        }
        switch (raw.strip().toLowerCase(Locale.ROOT).replace('_', '-')) {
            case "balance-topup":
            case "topup":
                return BALANCE_TOPUP;
            case "order-payment":
            case "order":
                return ORDER_PAYMENT;
            default:
                return null;
        }
    }
}
