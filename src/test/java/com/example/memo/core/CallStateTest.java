package com.example.memo.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CallStateTest {

    @Test
    void acceptsScalarStates() {
        assertNull(CallState.check(null));
        assertEquals("v1", CallState.check("v1"));
        assertEquals(3, CallState.check(3));
        assertEquals(Boolean.TRUE, CallState.check(true));
    }

    @Test
    void rejectsStructuredStates() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> CallState.check(List.of("v1")));
        assertTrue(ex.getMessage().contains("String, Number, Boolean or null"));
    }

    @Test
    void numbersCompareByValue() {
        assertTrue(CallState.same(1, 1L));
        assertTrue(CallState.same(2.0, 2));
        assertFalse(CallState.same(1, 2));
        assertFalse(CallState.same(Double.NaN, Double.NaN));
    }

    @Test
    void otherValuesCompareStrictly() {
        assertTrue(CallState.same(null, null));
        assertTrue(CallState.same("a", new String("a")));
        assertFalse(CallState.same(null, "a"));
        assertFalse(CallState.same("1", 1));
        assertFalse(CallState.same(true, "true"));
    }
}
