package com.example.memo.core;

import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * How a memoizer keys, validates and bounds its entries.
 *
 * <ul>
 *   <li>hasher: digest of the argument identifying its entry; equal arguments must give equal fingerprints</li>
 *   <li>stateOf: state of the argument; a change against the stored state invalidates the entry</li>
 *   <li>maxEntries: number of entries retained, least recently used ones are evicted first</li>
 *   <li>shouldCache: whether a successful result stays cached; defaults to always</li>
 *   <li>reusePolicy: whether pending handles are shared; defaults to {@link ReusePolicy#PENDING}</li>
 * </ul>
 */
public class CacheSettings<A, R> {

    private final Function<? super A, String> hasher;
    private final Function<? super A, ?> stateOf;
    private final int maxEntries;
    private final BiPredicate<? super R, ? super A> shouldCache;
    private final ReusePolicy reusePolicy;

    private CacheSettings(Builder<A, R> builder) {
        this.hasher = builder.hasher;
        this.stateOf = builder.stateOf;
        this.maxEntries = builder.maxEntries;
        this.shouldCache = builder.shouldCache;
        this.reusePolicy = builder.reusePolicy;
    }

    public static <A, R> Builder<A, R> builder() {
        return new Builder<>();
    }

    public Function<? super A, String> getHasher() {
        return hasher;
    }

    public Function<? super A, ?> getStateOf() {
        return stateOf;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public BiPredicate<? super R, ? super A> getShouldCache() {
        return shouldCache;
    }

    public ReusePolicy getReusePolicy() {
        return reusePolicy;
    }

    public static final class Builder<A, R> {
        private Function<? super A, String> hasher;
        private Function<? super A, ?> stateOf;
        private Integer maxEntries;
        private BiPredicate<? super R, ? super A> shouldCache = (result, argument) -> true;
        private ReusePolicy reusePolicy = ReusePolicy.PENDING;

        private Builder() {
        }

        public Builder<A, R> hasher(Function<? super A, String> hasher) {
            this.hasher = hasher;
            return this;
        }

        public Builder<A, R> stateOf(Function<? super A, ?> stateOf) {
            this.stateOf = stateOf;
            return this;
        }

        public Builder<A, R> maxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
            return this;
        }

        public Builder<A, R> shouldCache(BiPredicate<? super R, ? super A> shouldCache) {
            this.shouldCache = shouldCache;
            return this;
        }

        public Builder<A, R> reusePolicy(ReusePolicy reusePolicy) {
            this.reusePolicy = reusePolicy;
            return this;
        }

        public CacheSettings<A, R> build() {
            if (hasher == null) {
                throw new IllegalStateException("hasher is required");
            }
            if (stateOf == null) {
                throw new IllegalStateException("stateOf is required");
            }
            if (maxEntries == null) {
                throw new IllegalStateException("maxEntries is required");
            }
            if (maxEntries < 0) {
                throw new IllegalArgumentException("maxEntries must be >= 0, got " + maxEntries);
            }
            if (shouldCache == null || reusePolicy == null) {
                throw new IllegalStateException("shouldCache and reusePolicy must not be null");
            }
            return new CacheSettings<>(this);
        }
    }
}
