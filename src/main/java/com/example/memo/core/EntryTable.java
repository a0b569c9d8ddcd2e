package com.example.memo.core;

import java.util.HashMap;
import java.util.Map;

/**
 * Fingerprint -> entry lookup. Not thread-safe; owned by one {@link AsyncMemoizer}.
 */
public class EntryTable<R> {

    private final Map<String, CacheEntry<R>> store = new HashMap<>();

    public CacheEntry<R> get(String fingerprint) {
        return store.get(fingerprint);
    }

    public void put(CacheEntry<R> entry) {
        store.put(entry.fingerprint, entry);
    }

    /**
     * Removes the entry only if its fingerprint still maps to this very entry.
     * A stale entry must never drop a newer one that reuses the fingerprint.
     */
    public boolean remove(CacheEntry<R> entry) {
        if (store.get(entry.fingerprint) != entry) {
            return false;
        }
        store.remove(entry.fingerprint);
        return true;
    }

    public boolean contains(CacheEntry<R> entry) {
        return store.get(entry.fingerprint) == entry;
    }

    public int size() {
        return store.size();
    }

    public void clear() {
        store.clear();
    }
}
