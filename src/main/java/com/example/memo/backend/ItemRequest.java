package com.example.memo.backend;

/**
 * Argument of a backend fetch. The version is the caller's notion of the
 * item's state; a new version invalidates what was cached for the key.
 */
public class ItemRequest {

    private final String key;
    private final String version;

    public ItemRequest(String key, String version) {
        this.key = key;
        this.version = version;
    }

    public String getKey() {
        return key;
    }

    public String getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return version == null ? key : key + "@" + version;
    }
}
