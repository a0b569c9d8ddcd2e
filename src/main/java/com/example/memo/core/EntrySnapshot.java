package com.example.memo.core;

/**
 * Read-only view of one tracked entry, for diagnostics.
 */
public class EntrySnapshot {

    private final String fingerprint;
    private final Object state;
    private final boolean inUse;
    private final boolean resolved;
    private final long generation;
    private final long invocations;

    public EntrySnapshot(String fingerprint, Object state, boolean inUse, boolean resolved,
                         long generation, long invocations) {
        this.fingerprint = fingerprint;
        this.state = state;
        this.inUse = inUse;
        this.resolved = resolved;
        this.generation = generation;
        this.invocations = invocations;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public Object getState() {
        return state;
    }

    public boolean isInUse() {
        return inUse;
    }

    public boolean isResolved() {
        return resolved;
    }

    public long getGeneration() {
        return generation;
    }

    public long getInvocations() {
        return invocations;
    }

    @Override
    public String toString() {
        return fingerprint + "{state=" + state + ", resolved=" + resolved + ", invocations=" + invocations + "}";
    }
}
