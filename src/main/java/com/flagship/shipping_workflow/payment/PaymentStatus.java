package com.flagship.shipping_workflow.payment;

import java.util.Locale;
import java.util.Optional;

/**
 * Payment record lifecycle.
 *
 * Valid transitions:
 * - PENDING -> PAID (provider confirmed payment)
 * - PENDING -> FAILED (provider reported failure)
 * - PENDING -> EXPIRED (provider expiry, or left pending too long)
 * - FAILED/EXPIRED -> PAID (late payment still honoured)
 *
 * PAID is final.
 */
public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED,
    EXPIRED;

    /**
     * Maps a provider status string, case-insensitively. Intermediate provider
     * states (waiting, confirming) count as pending.
     */
    public static Optional<PaymentStatus> fromProvider(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.strip().toLowerCase(Locale.ROOT)) {
            case "paid" -> Optional.of(PAID);
            case "failed" -> Optional.of(FAILED);
            case "expired" -> Optional.of(EXPIRED);
            case "pending", "new", "waiting", "confirming" -> Optional.of(PENDING);
            default -> Optional.empty();
        };
    }
}
