package com.flagship.shipping_workflow.session;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of keys a session may carry.
 *
 * The key string is what gets persisted, so renaming a constant is safe but
 * changing a key is a data migration.
 */
public enum SessionField {
    FROM_NAME("from_name"),
    FROM_ADDRESS("from_address"),
    FROM_ADDRESS2("from_address2"),
    FROM_CITY("from_city"),
    FROM_STATE("from_state"),
    FROM_ZIP("from_zip"),
    FROM_PHONE("from_phone"),
    TO_NAME("to_name"),
    TO_ADDRESS("to_address"),
    TO_ADDRESS2("to_address2"),
    TO_CITY("to_city"),
    TO_STATE("to_state"),
    TO_ZIP("to_zip"),
    TO_PHONE("to_phone"),
    WEIGHT("weight"),
    LENGTH("length"),
    WIDTH("width"),
    HEIGHT("height"),
    SELECTED_QUOTE_ID("selected_quote_id"),
    SELECTED_CARRIER("selected_carrier"),
    SELECTED_SERVICE("selected_service"),
    SELECTED_AMOUNT("selected_amount"),
    PAYMENT_METHOD("payment_method"),
    LAST_ERROR("last_error"),
    ERROR_STEP("error_step");

    private static final Map<String, SessionField> BY_KEY = Arrays.stream(values())
            .collect(Collectors.toMap(SessionField::getKey, Function.identity()));

    private final String key;

    SessionField(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Optional<SessionField> fromKey(String key) {
        return Optional.ofNullable(BY_KEY.get(key));
    }
}
