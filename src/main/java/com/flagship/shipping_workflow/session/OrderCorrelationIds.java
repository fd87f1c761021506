package com.flagship.shipping_workflow.session;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Generates the identifier that ties a session to the order it becomes.
 */
public final class OrderCorrelationIds {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private OrderCorrelationIds() {
        // Utility class
    }

    /**
     * Format: {@code ORD-<yyyyMMdd>-<8 hex chars>}.
     */
    public static String generate(Instant now) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase();
        return "ORD-" + DAY.format(now) + "-" + suffix;
    }
}
