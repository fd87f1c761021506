package com.flagship.shipping_workflow.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys shown by the log pattern, and scopes that set them for a block.
 *
 * <pre>
 * try (MDC.MDCCloseable user = CorrelationContext.user(userKey)) {
 *     ...
 * }
 * </pre>
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String USER_KEY_MDC_KEY = "userKey";
    public static final String EXTERNAL_REFERENCE_MDC_KEY = "externalReference";

    private static final int MAX_INCOMING_LENGTH = 64;

    private CorrelationContext() {
    }

    /**
     * The caller's id when it is usable, otherwise a fresh short one.
     */
    public static String resolve(String incoming) {
        if (incoming == null || incoming.isBlank() || incoming.length() > MAX_INCOMING_LENGTH) {
            return newCorrelationId();
        }
        return incoming.trim();
    }

    public static String newCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static String currentCorrelationId() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    public static MDC.MDCCloseable correlation(String correlationId) {
        return MDC.putCloseable(CORRELATION_ID_MDC_KEY, correlationId);
    }

    public static MDC.MDCCloseable user(String userKey) {
        return MDC.putCloseable(USER_KEY_MDC_KEY, userKey);
    }

    public static MDC.MDCCloseable payment(String externalReference) {
        return MDC.putCloseable(EXTERNAL_REFERENCE_MDC_KEY, externalReference);
    }
}
