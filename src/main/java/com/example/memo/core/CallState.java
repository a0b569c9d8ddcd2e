package com.example.memo.core;

import java.util.Objects;

/**
 * Call states are limited to String, Number, Boolean or null and compare strictly:
 * numbers by numeric value (NaN never matches), everything else with equals.
 */
public final class CallState {

    private CallState() {
    }

    public static Object check(Object state) {
        if (state == null || state instanceof String || state instanceof Number || state instanceof Boolean) {
            return state;
        }
        throw new IllegalArgumentException(
            "Call state must be a String, Number, Boolean or null, got " + state.getClass().getName());
    }

    public static boolean same(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return ((Number) a).doubleValue() == ((Number) b).doubleValue();
        }
        return Objects.equals(a, b);
    }
}
