package com.flagship.shipping_workflow.workflow;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InputValidatorsTest {

    @Test
    @DisplayName("Names: Latin letters with . - ' and 2-50 characters")
    void name() {
        assertEquals("John O'Neil-Smith Jr.", InputValidators.name("  John O'Neil-Smith Jr. ").getValue());
        assertFalse(InputValidators.name("J").isValid());
        assertFalse(InputValidators.name("A".repeat(51)).isValid());
        assertFalse(InputValidators.name("John3").isValid());

        ValidationResult cyrillic = InputValidators.name("Иван Петров");
        assertFalse(cyrillic.isValid());
        assertTrue(cyrillic.getError().contains("Latin"));
    }

    @Test
    @DisplayName("Addresses allow digits and . , - # & /")
    void address() {
        assertTrue(InputValidators.address("123 Main St, Apt #4B").isValid());
        assertTrue(InputValidators.address("1/2 Elm & Oak").isValid());
        assertFalse(InputValidators.address("12").isValid());
        assertFalse(InputValidators.address("123 Main St!").isValid());
    }

    @Test
    @DisplayName("City rejects digits")
    void city() {
        assertEquals("Coeur d'Alene", InputValidators.city("Coeur d'Alene").getValue());
        assertFalse(InputValidators.city("Area 51").isValid());
    }

    @Test
    @DisplayName("State is a known two-letter code, stored upper-case")
    void state() {
        assertEquals("CA", InputValidators.state("ca").getValue());
        assertEquals("PR", InputValidators.state("pr").getValue());
        assertFalse(InputValidators.state("ZZ").isValid());
        assertFalse(InputValidators.state("Cal").isValid());
        assertFalse(InputValidators.state("1A").isValid());
    }

    @Test
    @DisplayName("ZIP is five digits with optional +4")
    void zip() {
        assertTrue(InputValidators.zip("78701").isValid());
        assertTrue(InputValidators.zip("78701-1234").isValid());
        assertFalse(InputValidators.zip("7870").isValid());
        assertFalse(InputValidators.zip("78701-12").isValid());
    }

    @Test
    @DisplayName("Phone is normalized to E.164 with a +1 default country code")
    void phone() {
        assertEquals("+15125551234", InputValidators.phone("5125551234").getValue());
        assertEquals("+15125551234", InputValidators.phone("512-555-1234").getValue());
        assertEquals("+15125551234", InputValidators.phone("+1 512 555 1234").getValue());
        assertFalse(InputValidators.phone("555-1234").isValid());
        assertFalse(InputValidators.phone("phone").isValid());
        assertFalse(InputValidators.phone("(512) 555-1234").isValid());
    }

    @Test
    @DisplayName("Weight must lie in 0.1-150 lb, decimal comma accepted")
    void weight() {
        assertEquals("2.5", InputValidators.weight("2,50").getValue());
        assertEquals("150", InputValidators.weight("150").getValue());
        assertFalse(InputValidators.weight("0").isValid());
        assertFalse(InputValidators.weight("0.05").isValid());
        assertFalse(InputValidators.weight("150.1").isValid());
        assertFalse(InputValidators.weight("heavy").isValid());
    }

    @Test
    @DisplayName("Dimensions must lie in 0.1-108 in")
    void dimension() {
        assertEquals("12", InputValidators.dimension("12.0").getValue());
        assertTrue(InputValidators.dimension("108").isValid());
        assertFalse(InputValidators.dimension("109").isValid());
    }
}
