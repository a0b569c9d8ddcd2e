package com.example.memo.core;

/**
 * Thrown when a call arrives for a fingerprint whose computation is still in
 * its synchronous phase, i.e. the computation (directly or not) called itself
 * with the same fingerprint.
 */
public class ReentrantRecursionException extends MemoCacheException {

    private final String fingerprint;

    public ReentrantRecursionException(String fingerprint) {
        super("Recursion on exactly the same cached computation detected: " + fingerprint);
        this.fingerprint = fingerprint;
    }

    public String getFingerprint() {
        return fingerprint;
    }
}
