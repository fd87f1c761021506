package com.flagship.shipping_workflow.order;

import java.util.Locale;
import java.util.Optional;

/**
 * How the user pays for an order.
 */
public enum PaymentMethod {
    /** Deducted immediately from the user's prepaid balance. */
    BALANCE,
    /** Paid later through an invoice issued by the payment provider. */
    INVOICE;

    public static Optional<PaymentMethod> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.strip().toLowerCase(Locale.ROOT)) {
            case "balance" -> Optional.of(BALANCE);
            case "invoice", "crypto" -> Optional.of(INVOICE);
            default -> Optional.empty();
        };
    }
}
