package com.flagship.shipping_workflow.template;

import com.flagship.shipping_workflow.session.FieldPatch;
import com.flagship.shipping_workflow.session.SessionField;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Saved sender and recipient of a past shipment. Starting an order from a
 * template skips straight to the parcel questions.
 *
 * Skipped address fields are kept as explicit nulls so a template-started
 * session looks exactly like one that walked the address steps.
 */
@Value
public class AddressTemplate {

    public static final Set<SessionField> ADDRESS_FIELDS = Collections.unmodifiableSet(EnumSet.of(
            SessionField.FROM_NAME, SessionField.FROM_ADDRESS, SessionField.FROM_ADDRESS2,
            SessionField.FROM_CITY, SessionField.FROM_STATE, SessionField.FROM_ZIP, SessionField.FROM_PHONE,
            SessionField.TO_NAME, SessionField.TO_ADDRESS, SessionField.TO_ADDRESS2,
            SessionField.TO_CITY, SessionField.TO_STATE, SessionField.TO_ZIP, SessionField.TO_PHONE));

    UUID id;
    String userKey;
    String name;
    Map<SessionField, String> fields;
    Instant createdAt;

    public AddressTemplate(UUID id, String userKey, String name, Map<SessionField, String> fields, Instant createdAt) {
        this.id = id;
        this.userKey = userKey;
        this.name = name;
        EnumMap<SessionField, String> copy = new EnumMap<>(SessionField.class);
        fields.forEach((field, value) -> {
            if (ADDRESS_FIELDS.contains(field)) {
                copy.put(field, value);
            }
        });
        this.fields = Collections.unmodifiableMap(copy);
        this.createdAt = createdAt;
    }

    public FieldPatch toPatch() {
        FieldPatch patch = FieldPatch.empty();
        for (Map.Entry<SessionField, String> entry : fields.entrySet()) {
            patch = patch.with(entry.getKey(), entry.getValue());
        }
        return patch;
    }
}
