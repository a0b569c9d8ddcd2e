package com.example.memo.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CacheSettingsTest {

    @Test
    void defaultsToAlwaysCacheAndPendingReuse() {
        CacheSettings<String, String> settings = CacheSettings.<String, String>builder()
                .hasher(s -> s)
                .stateOf(s -> null)
                .maxEntries(5)
                .build();

        assertEquals(5, settings.getMaxEntries());
        assertEquals(ReusePolicy.PENDING, settings.getReusePolicy());
        assertTrue(settings.getShouldCache().test("anything", "arg"));
    }

    @Test
    void requiresHasherStateAndMaxEntries() {
        assertThrows(IllegalStateException.class, () -> CacheSettings.<String, String>builder()
                .stateOf(s -> null).maxEntries(1).build());
        assertThrows(IllegalStateException.class, () -> CacheSettings.<String, String>builder()
                .hasher(s -> s).maxEntries(1).build());
        assertThrows(IllegalStateException.class, () -> CacheSettings.<String, String>builder()
                .hasher(s -> s).stateOf(s -> null).build());
    }

    @Test
    void rejectsNegativeMaxEntries() {
        assertThrows(IllegalArgumentException.class, () -> CacheSettings.<String, String>builder()
                .hasher(s -> s).stateOf(s -> null).maxEntries(-1).build());
    }
}
