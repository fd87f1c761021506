package com.flagship.shipping_workflow.shipment;

import com.flagship.shipping_workflow.session.Session;
import com.flagship.shipping_workflow.session.SessionField;
import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Typed view of the shipment data collected in a session.
 */
@Value
public class ShipmentDetails {

    private static final Set<SessionField> REQUIRED = EnumSet.of(
        SessionField.FROM_NAME, SessionField.FROM_ADDRESS, SessionField.FROM_CITY,
        SessionField.FROM_STATE, SessionField.FROM_ZIP,
        SessionField.TO_NAME, SessionField.TO_ADDRESS, SessionField.TO_CITY,
        SessionField.TO_STATE, SessionField.TO_ZIP,
        SessionField.WEIGHT
    );

    Address from;
    Address to;
    Parcel parcel;

    /**
     * Builds the shipment from session fields. Missing or skipped dimensions
     * fall back to {@code defaultDimension}.
     *
     * @throws IllegalStateException if a required field has not been collected
     */
    public static ShipmentDetails fromSession(Session session, BigDecimal defaultDimension) {
        List<String> missing = new ArrayList<>();
        for (SessionField field : REQUIRED) {
            if (session.field(field).isEmpty()) {
                missing.add(field.getKey());
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Shipment data incomplete, missing: " + missing);
        }

        Address from = new Address(
            value(session, SessionField.FROM_NAME),
            value(session, SessionField.FROM_ADDRESS),
            value(session, SessionField.FROM_ADDRESS2),
            value(session, SessionField.FROM_CITY),
            value(session, SessionField.FROM_STATE),
            value(session, SessionField.FROM_ZIP),
            value(session, SessionField.FROM_PHONE)
        );
        Address to = new Address(
            value(session, SessionField.TO_NAME),
            value(session, SessionField.TO_ADDRESS),
            value(session, SessionField.TO_ADDRESS2),
            value(session, SessionField.TO_CITY),
            value(session, SessionField.TO_STATE),
            value(session, SessionField.TO_ZIP),
            value(session, SessionField.TO_PHONE)
        );
        Parcel parcel = new Parcel(
            new BigDecimal(value(session, SessionField.WEIGHT)),
            dimension(session, SessionField.LENGTH, defaultDimension),
            dimension(session, SessionField.WIDTH, defaultDimension),
            dimension(session, SessionField.HEIGHT, defaultDimension)
        );
        return new ShipmentDetails(from, to, parcel);
    }

    private static String value(Session session, SessionField field) {
        return session.field(field).orElse(null);
    }

    private static BigDecimal dimension(Session session, SessionField field, BigDecimal defaultDimension) {
        return session.field(field).map(BigDecimal::new).orElse(defaultDimension);
    }
}
