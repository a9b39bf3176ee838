package com.yieldsolver.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for enums
 */
class EnumTest {

    @Test
    void testIterationMode() {
        // Test fromValue
        assertEquals(IterationMode.FIXED, IterationMode.fromValue("FIXED"));
        assertEquals(IterationMode.EARLY_EXIT, IterationMode.fromValue("EARLY_EXIT"));

        // Test case insensitivity
        assertEquals(IterationMode.FIXED, IterationMode.fromValue("fixed"));
        assertEquals(IterationMode.EARLY_EXIT, IterationMode.fromValue("early_exit"));

        // Test isValid
        assertTrue(IterationMode.isValid("FIXED"));
        assertFalse(IterationMode.isValid("ADAPTIVE"));

        // Test invalid value
        assertThrows(IllegalArgumentException.class, () -> IterationMode.fromValue("ADAPTIVE"));
    }

    @Test
    void testPaymentTiming() {
        // Numeric and named forms
        assertEquals(PaymentTiming.END, PaymentTiming.fromValue(0));
        assertEquals(PaymentTiming.BEGIN, PaymentTiming.fromValue(1));
        assertEquals(PaymentTiming.END, PaymentTiming.fromValue("0"));
        assertEquals(PaymentTiming.BEGIN, PaymentTiming.fromValue("begin"));
        assertEquals(PaymentTiming.END, PaymentTiming.fromValue("END"));

        // Test getValue
        assertEquals(0, PaymentTiming.END.getValue());
        assertEquals(1, PaymentTiming.BEGIN.getValue());

        // Test isValid
        assertTrue(PaymentTiming.isValid("1"));
        assertFalse(PaymentTiming.isValid("2"));
        assertFalse(PaymentTiming.isValid(null));

        assertThrows(IllegalArgumentException.class, () -> PaymentTiming.fromValue(2));
        assertThrows(IllegalArgumentException.class, () -> PaymentTiming.fromValue("middle"));
    }

    @Test
    void testTimeValueFunction() {
        assertEquals(TimeValueFunction.FV, TimeValueFunction.fromValue("fv"));
        assertEquals(TimeValueFunction.PPMT, TimeValueFunction.fromValue("PPMT"));

        assertTrue(TimeValueFunction.isValid("nper"));
        assertFalse(TimeValueFunction.isValid("rate"));
        assertThrows(IllegalArgumentException.class, () -> TimeValueFunction.fromValue("rate"));
    }
}
