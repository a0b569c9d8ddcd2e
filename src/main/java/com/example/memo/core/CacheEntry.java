package com.example.memo.core;

import java.util.concurrent.CompletableFuture;

public class CacheEntry<R> {
    public final String fingerprint;
    public Object state;                 // last observed call state: String, Number, Boolean or null
    public CompletableFuture<R> result;  // settles after bookkeeping; callers only ever get copies
    public boolean inUse;                // true while the computation's synchronous phase runs
    public Thread owner;                 // thread running the synchronous phase, null otherwise
    public boolean resolved;             // true once the current invocation completed successfully
    public long generation;              // bumped per invocation, checked by completion callbacks
    public long invocations;

    public CacheEntry(String fingerprint, Object state) {
        this.fingerprint = fingerprint;
        this.state = state;
    }

    /**
     * Starts a new invocation and returns its generation.
     */
    long begin() {
        inUse = true;
        owner = Thread.currentThread();
        resolved = false;
        invocations++;
        return ++generation;
    }

    void end() {
        inUse = false;
        owner = null;
    }

    boolean isCurrent(long invocationGeneration) {
        return generation == invocationGeneration;
    }

    EntrySnapshot snapshot() {
        return new EntrySnapshot(fingerprint, state, inUse, resolved, generation, invocations);
    }
}
