package com.example.memo.core;

/**
 * Wraps a checked exception thrown by the computation before it produced a stage.
 */
public class SynchronousInvocationException extends MemoCacheException {

    private final String fingerprint;

    public SynchronousInvocationException(String fingerprint, Throwable cause) {
        super("Computation failed before producing a result for " + fingerprint, cause);
        this.fingerprint = fingerprint;
    }

    public String getFingerprint() {
        return fingerprint;
    }
}
