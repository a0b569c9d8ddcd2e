package com.example.memo.core;

import com.example.memo.eviction.RecencyList;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Memoizes an {@link AsyncComputation} by argument fingerprint, keeping at most
 * {@code maxEntries} entries in least-recently-used order.
 *
 * <p>Per call the argument is fingerprinted and its state derived. An unknown
 * fingerprint creates an entry and invokes the computation. A known one is
 * reused while its state is unchanged (and, under
 * {@link ReusePolicy#RESOLVED_ONLY}, while its last invocation succeeded);
 * otherwise the computation is invoked again and the new handle replaces the
 * old one. A call for a fingerprint whose computation is still in its
 * synchronous phase on the calling thread fails with
 * {@link ReentrantRecursionException}; a call from another thread waits for
 * that phase to end.
 *
 * <p>Failed invocations and results rejected by {@code shouldCache} detach
 * their entry before the returned future completes, so the next call starts
 * fresh. Completion callbacks of superseded invocations are ignored.
 * Every call gets its own copy of the entry's future, so cancelling or
 * completing a returned future never affects the entry or other callers.
 *
 * <p>All bookkeeping runs under one lock. The lock is released while the
 * computation runs, both its synchronous phase and the pending result.
 */
public class AsyncMemoizer<A, R> implements Function<A, CompletableFuture<R>> {

    private static final Logger log = LoggerFactory.getLogger(AsyncMemoizer.class);

    private final AsyncComputation<A, R> computation;
    private final CacheSettings<A, R> settings;
    private final EntryTable<R> entries = new EntryTable<>();
    private final RecencyList<CacheEntry<R>> order = new RecencyList<>();
    private final CacheStats stats = new CacheStats();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition invocationDone = lock.newCondition();

    public AsyncMemoizer(AsyncComputation<A, R> computation, CacheSettings<A, R> settings) {
        if (computation == null || settings == null) {
            throw new IllegalArgumentException("computation and settings are required");
        }
        this.computation = computation;
        this.settings = settings;
    }

    public static <A, R> AsyncMemoizer<A, R> wrap(AsyncComputation<A, R> computation, CacheSettings<A, R> settings) {
        return new AsyncMemoizer<>(computation, settings);
    }

    @Override
    public CompletableFuture<R> apply(A argument) {
        return call(argument);
    }

    public CompletableFuture<R> call(A argument) {
        String fingerprint = fingerprintOf(argument);
        Object state = CallState.check(settings.getStateOf().apply(argument));

        lock.lock();
        try {
            CacheEntry<R> entry = awaitIdleEntry(fingerprint);
            if (entry == null) {
                return createEntry(fingerprint, state, argument);
            }
            if (isReusable(entry, state)) {
                stats.recordHit();
                order.promote(entry);
                return entry.result.copy();
            }

            stats.recordInvalidation();
            log.debug("Invalidating {} (state {} -> {})", fingerprint, entry.state, state);
            entry.state = state;
            CompletableFuture<R> result = invoke(entry, argument);
            // a stage that already failed detaches the entry during invoke
            if (entries.contains(entry)) {
                order.promote(entry);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Detaches the entry for {@code argument}, if any.
     *
     * @return true if an entry was removed
     */
    public boolean invalidate(A argument) {
        return invalidateFingerprint(fingerprintOf(argument));
    }

    public boolean invalidateFingerprint(String fingerprint) {
        lock.lock();
        try {
            CacheEntry<R> entry = awaitIdleEntry(fingerprint);
            if (entry == null) {
                return false;
            }
            return detach(entry, "invalidated");
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            int dropped = order.size();
            order.clear();
            entries.clear();
            log.debug("Cleared {} entries", dropped);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return order.size();
        } finally {
            lock.unlock();
        }
    }

    public int maxEntries() {
        return settings.getMaxEntries();
    }

    public ReusePolicy reusePolicy() {
        return settings.getReusePolicy();
    }

    public CacheStats stats() {
        return stats;
    }

    /**
     * Tracked entries from most to least recently used.
     */
    public List<EntrySnapshot> snapshot() {
        lock.lock();
        try {
            List<EntrySnapshot> view = new ArrayList<>(order.size());
            for (CacheEntry<R> entry : order.toList()) {
                view.add(entry.snapshot());
            }
            return view;
        } finally {
            lock.unlock();
        }
    }

    private String fingerprintOf(A argument) {
        String fingerprint = settings.getHasher().apply(argument);
        if (fingerprint == null) {
            throw new IllegalArgumentException("hasher returned null for " + argument);
        }
        return fingerprint;
    }

    /**
     * Current entry for the fingerprint once no other thread is in its
     * synchronous phase. Must be called with the lock held.
     *
     * @throws ReentrantRecursionException if the calling thread itself is in that phase
     */
    private CacheEntry<R> awaitIdleEntry(String fingerprint) {
        CacheEntry<R> entry = entries.get(fingerprint);
        while (entry != null && entry.inUse) {
            if (entry.owner == Thread.currentThread()) {
                stats.recordRecursion();
                log.error("Recursion on exactly the same cached computation detected: {}", fingerprint);
                throw new ReentrantRecursionException(fingerprint);
            }
            invocationDone.awaitUninterruptibly();
            entry = entries.get(fingerprint);
        }
        return entry;
    }

    private boolean isReusable(CacheEntry<R> entry, Object state) {
        if (!CallState.same(state, entry.state)) {
            return false;
        }
        return settings.getReusePolicy() == ReusePolicy.PENDING || entry.resolved;
    }

    private CompletableFuture<R> createEntry(String fingerprint, Object state, A argument) {
        stats.recordMiss();
        CacheEntry<R> entry = new CacheEntry<>(fingerprint, state);
        entries.put(entry);
        order.promote(entry);
        CompletableFuture<R> result = invoke(entry, argument);
        evictOverflow();
        return result;
    }

    /**
     * Runs the computation for {@code entry}. Called with the lock held; the
     * lock is fully released while the computation's synchronous phase runs,
     * so completions of other entries are never blocked behind it.
     */
    private CompletableFuture<R> invoke(CacheEntry<R> entry, A argument) {
        long generation = entry.begin();
        CompletionStage<R> stage = null;
        Throwable failure = null;
        int holds = lock.getHoldCount();
        for (int i = 0; i < holds; i++) {
            lock.unlock();
        }
        try {
            stage = computation.compute(argument);
        } catch (Exception | Error e) {
            failure = e;
        } finally {
            for (int i = 0; i < holds; i++) {
                lock.lock();
            }
        }

        try {
            if (failure == null && stage == null) {
                failure = new IllegalStateException("Computation returned no result for " + entry.fingerprint);
            }
            if (failure != null) {
                abortInvocation(entry, failure);
                if (failure instanceof RuntimeException) {
                    throw (RuntimeException) failure;
                }
                if (failure instanceof Error) {
                    throw (Error) failure;
                }
                throw new SynchronousInvocationException(entry.fingerprint, failure);
            }

            // private to the entry: bookkeeping cannot be cancelled away by a caller
            entry.result = stage
                .whenComplete((value, error) -> settle(entry, generation, argument, value, error))
                .toCompletableFuture();
            return entry.result.copy();
        } finally {
            entry.end();
            invocationDone.signalAll();
        }
    }

    private void abortInvocation(CacheEntry<R> entry, Throwable cause) {
        stats.recordFailure();
        log.debug("Computation for {} threw synchronously: {}", entry.fingerprint, cause.toString());
        detach(entry, "synchronous failure");
    }

    private void settle(CacheEntry<R> entry, long generation, A argument, R value, Throwable failure) {
        lock.lock();
        try {
            if (!entry.isCurrent(generation)) {
                return; // superseded by a later invocation
            }
            if (failure != null) {
                stats.recordFailure();
                detach(entry, "failed");
                return;
            }
            entry.resolved = true;
            boolean keep;
            try {
                keep = settings.getShouldCache().test(value, argument);
            } catch (RuntimeException e) {
                detach(entry, "shouldCache failed");
                throw e;
            }
            if (!keep) {
                stats.recordUncacheable();
                detach(entry, "not cacheable");
            }
        } finally {
            lock.unlock();
        }
    }

    private void evictOverflow() {
        while (order.size() > settings.getMaxEntries()) {
            CacheEntry<R> victim = order.leastRecent().orElseThrow();
            order.remove(victim);
            entries.remove(victim);
            stats.recordEviction();
            log.debug("Evicted {} (maxEntries={})", victim.fingerprint, settings.getMaxEntries());
        }
    }

    private boolean detach(CacheEntry<R> entry, String reason) {
        boolean inList = order.remove(entry);
        boolean inTable = entries.remove(entry);
        if (inList || inTable) {
            log.debug("Detached {}: {}", entry.fingerprint, reason);
            return true;
        }
        return false;
    }
}
