package com.example.memo.core;

/**
 * When an entry whose state did not change may be handed out again.
 */
public enum ReusePolicy {
    /** Reuse the handle as soon as the synchronous phase finished, pending or not. */
    PENDING,
    /** Reuse only once the current invocation completed successfully; re-invoke otherwise. */
    RESOLVED_ONLY
}
