package com.example.memo.backend;

import com.example.memo.config.MemoProperties;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Simulated slow backend. Keys starting with {@code fail-} fail, keys starting
 * with {@code empty-} resolve to an empty value.
 */
@Component
public class SlowBackend {

    public static final String FAILING_PREFIX = "fail-";
    public static final String EMPTY_PREFIX = "empty-";

    private static final Logger log = LoggerFactory.getLogger(SlowBackend.class);

    private final AtomicLong requestCount = new AtomicLong();
    private final ExecutorService asyncExecutor;
    private volatile long latencyMillis;

    public SlowBackend(MemoProperties properties) {
        this.latencyMillis = properties.getBackend().getLatencyMs();
        // Dedicated pool so simulated latency never blocks the common pool
        this.asyncExecutor = Executors.newFixedThreadPool(properties.getBackend().getPoolSize());
    }

    public CompletableFuture<String> fetch(ItemRequest request) {
        requestCount.incrementAndGet();
        log.debug("Backend fetch for {}", request);
        return CompletableFuture.supplyAsync(() -> load(request), asyncExecutor);
    }

    private String load(ItemRequest request) {
        try {
            if (latencyMillis > 0) {
                Thread.sleep(latencyMillis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException(request.getKey(), "Interrupted while fetching " + request);
        }
        String key = request.getKey();
        if (key.startsWith(FAILING_PREFIX)) {
            throw new BackendException(key, "Backend failed for " + request);
        }
        if (key.startsWith(EMPTY_PREFIX)) {
            return "";
        }
        return "value-for-" + request;
    }

    public void setLatencyMillis(long ms) {
        this.latencyMillis = ms;
    }

    public long getLatencyMillis() {
        return latencyMillis;
    }

    public long getRequestCount() {
        return requestCount.get();
    }

    public void resetCount() {
        requestCount.set(0);
    }

    @PreDestroy
    public void shutdown() {
        asyncExecutor.shutdownNow();
    }
}
