package com.example.memo.config;

import com.example.memo.core.ReusePolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings of the memoized item endpoint.
 */
@Validated
@ConfigurationProperties(prefix = "memo")
public class MemoProperties {

    /** Entries kept before the least recently used one is evicted. */
    @Min(0)
    private int maxEntries = 10_000;

    /** Whether a pending backend call is shared by calls with the same key and version. */
    @NotNull
    private ReusePolicy reusePolicy = ReusePolicy.PENDING;

    @Valid
    private Backend backend = new Backend();

    public int getMaxEntries() {
        return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
        this.maxEntries = maxEntries;
    }

    public ReusePolicy getReusePolicy() {
        return reusePolicy;
    }

    public void setReusePolicy(ReusePolicy reusePolicy) {
        this.reusePolicy = reusePolicy;
    }

    public Backend getBackend() {
        return backend;
    }

    public void setBackend(Backend backend) {
        this.backend = backend;
    }

    public static class Backend {

        /** Simulated latency of one backend fetch. */
        @Min(0)
        private long latencyMs = 500;

        /** Threads serving backend fetches. */
        @Min(1)
        private int poolSize = 16;

        public long getLatencyMs() {
            return latencyMs;
        }

        public void setLatencyMs(long latencyMs) {
            this.latencyMs = latencyMs;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }
    }
}
