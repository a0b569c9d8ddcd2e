package com.example.memo.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters of one memoizer.
 */
public class CacheStats {

    private final AtomicLong hits = new AtomicLong();          // existing handle returned
    private final AtomicLong misses = new AtomicLong();        // new entry created
    private final AtomicLong invalidations = new AtomicLong(); // existing entry re-invoked
    private final AtomicLong evictions = new AtomicLong();     // dropped for capacity
    private final AtomicLong failures = new AtomicLong();      // invocation failed, sync or async
    private final AtomicLong uncacheable = new AtomicLong();   // rejected by shouldCache
    private final AtomicLong recursions = new AtomicLong();    // rejected as reentrant recursion

    void recordHit() {
        hits.incrementAndGet();
    }

    void recordMiss() {
        misses.incrementAndGet();
    }

    void recordInvalidation() {
        invalidations.incrementAndGet();
    }

    void recordEviction() {
        evictions.incrementAndGet();
    }

    void recordFailure() {
        failures.incrementAndGet();
    }

    void recordUncacheable() {
        uncacheable.incrementAndGet();
    }

    void recordRecursion() {
        recursions.incrementAndGet();
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public long getInvalidations() {
        return invalidations.get();
    }

    public long getEvictions() {
        return evictions.get();
    }

    public long getFailures() {
        return failures.get();
    }

    public long getUncacheable() {
        return uncacheable.get();
    }

    public long getRecursions() {
        return recursions.get();
    }

    public void reset() {
        hits.set(0);
        misses.set(0);
        invalidations.set(0);
        evictions.set(0);
        failures.set(0);
        uncacheable.set(0);
        recursions.set(0);
    }

    public Map<String, Long> asMap() {
        Map<String, Long> map = new LinkedHashMap<>();
        map.put("hits", getHits());
        map.put("misses", getMisses());
        map.put("invalidations", getInvalidations());
        map.put("evictions", getEvictions());
        map.put("failures", getFailures());
        map.put("uncacheable", getUncacheable());
        map.put("recursions", getRecursions());
        return map;
    }
}
