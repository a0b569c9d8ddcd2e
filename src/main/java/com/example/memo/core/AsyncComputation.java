package com.example.memo.core;

import java.util.concurrent.CompletionStage;

/**
 * The wrapped single-argument asynchronous function.
 *
 * Anything thrown from {@link #compute} itself (as opposed to a failed stage)
 * is a synchronous invocation failure.
 */
@FunctionalInterface
public interface AsyncComputation<A, R> {
    CompletionStage<R> compute(A argument) throws Exception;
}
