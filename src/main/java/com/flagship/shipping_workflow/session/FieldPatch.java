package com.flagship.shipping_workflow.session;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable partial update of a session's field map.
 *
 * A patch may carry a {@code null} value for a field. That is an explicit
 * write (the user skipped the field) and is stored as such, unlike a key
 * that is simply not part of the patch.
 */
public final class FieldPatch {

    private static final FieldPatch EMPTY = new FieldPatch(new EnumMap<>(SessionField.class));

    private final EnumMap<SessionField, String> values;

    private FieldPatch(EnumMap<SessionField, String> values) {
        this.values = values;
    }

    public static FieldPatch empty() {
        return EMPTY;
    }

    public static FieldPatch of(SessionField field, String value) {
        return EMPTY.with(field, value);
    }

    /**
     * Returns a new patch with the given field set, keeping this one unchanged.
     */
    public FieldPatch with(SessionField field, String value) {
        Objects.requireNonNull(field, "field");
        EnumMap<SessionField, String> copy = new EnumMap<>(SessionField.class);
        copy.putAll(values);
        copy.put(field, value);
        return new FieldPatch(copy);
    }

    public FieldPatch merge(FieldPatch other) {
        EnumMap<SessionField, String> copy = new EnumMap<>(SessionField.class);
        copy.putAll(values);
        copy.putAll(other.values);
        return new FieldPatch(copy);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public boolean contains(SessionField field) {
        return values.containsKey(field);
    }

    public String get(SessionField field) {
        return values.get(field);
    }

    public Map<SessionField, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * Persisted form: storage keys to values, nulls preserved.
     */
    public Map<String, String> toStorageMap() {
        Map<String, String> storage = new LinkedHashMap<>();
        values.forEach((field, value) -> storage.put(field.getKey(), value));
        return storage;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldPatch)) return false;
        return values.equals(((FieldPatch) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "FieldPatch" + values;
    }
}
