package com.flagship.shipping_workflow.shipment;

import com.flagship.shipping_workflow.session.Session;
import com.flagship.shipping_workflow.session.SessionField;
import com.flagship.shipping_workflow.workflow.WorkflowStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShipmentDetailsTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
    private static final BigDecimal DEFAULT_DIMENSION = BigDecimal.TEN;

    @Test
    @DisplayName("Collected fields map onto sender, recipient and parcel")
    void fromSession_complete() {
        Map<SessionField, String> fields = collected();
        fields.put(SessionField.LENGTH, "12");
        fields.put(SessionField.WIDTH, "8.5");
        fields.put(SessionField.HEIGHT, "4");

        ShipmentDetails shipment = ShipmentDetails.fromSession(session(fields), DEFAULT_DIMENSION);

        assertEquals("Ada Lovelace", shipment.getFrom().getName());
        assertEquals("Austin", shipment.getFrom().getCity());
        assertEquals("+15125551234", shipment.getFrom().getPhone());
        assertEquals("Grace Hopper", shipment.getTo().getName());
        assertEquals("10001", shipment.getTo().getZip());
        assertEquals(0, new BigDecimal("2.5").compareTo(shipment.getParcel().getWeight()));
        assertEquals(0, new BigDecimal("8.5").compareTo(shipment.getParcel().getWidth()));
    }

    @Test
    @DisplayName("Skipped address line and dimensions fall back to null and the default size")
    void fromSession_skippedFields() {
        Map<SessionField, String> fields = collected();
        fields.put(SessionField.FROM_ADDRESS2, null);
        fields.put(SessionField.LENGTH, null);

        ShipmentDetails shipment = ShipmentDetails.fromSession(session(fields), DEFAULT_DIMENSION);

        assertNull(shipment.getFrom().getLine2());
        assertEquals(DEFAULT_DIMENSION, shipment.getParcel().getLength());
        assertEquals(DEFAULT_DIMENSION, shipment.getParcel().getWidth());
        assertEquals(DEFAULT_DIMENSION, shipment.getParcel().getHeight());
    }

    @Test
    @DisplayName("A session missing required fields cannot be turned into a shipment")
    void fromSession_incomplete() {
        Map<SessionField, String> fields = collected();
        fields.remove(SessionField.TO_ZIP);
        fields.remove(SessionField.WEIGHT);

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> ShipmentDetails.fromSession(session(fields), DEFAULT_DIMENSION));
        assertTrue(e.getMessage().contains("to_zip"));
        assertTrue(e.getMessage().contains("weight"));
    }

    private static Map<SessionField, String> collected() {
        Map<SessionField, String> fields = new HashMap<>();
        fields.put(SessionField.FROM_NAME, "Ada Lovelace");
        fields.put(SessionField.FROM_ADDRESS, "100 Congress Ave");
        fields.put(SessionField.FROM_CITY, "Austin");
        fields.put(SessionField.FROM_STATE, "TX");
        fields.put(SessionField.FROM_ZIP, "78701");
        fields.put(SessionField.FROM_PHONE, "+15125551234");
        fields.put(SessionField.TO_NAME, "Grace Hopper");
        fields.put(SessionField.TO_ADDRESS, "1 Liberty Plaza");
        fields.put(SessionField.TO_CITY, "New York");
        fields.put(SessionField.TO_STATE, "NY");
        fields.put(SessionField.TO_ZIP, "10001");
        fields.put(SessionField.WEIGHT, "2.5");
        return fields;
    }

    private static Session session(Map<SessionField, String> fields) {
        return new Session("tg:1", "ORD-20260302-1A2B3C4D", WorkflowStep.CONFIRM_DATA, fields, NOW, NOW);
    }
}
