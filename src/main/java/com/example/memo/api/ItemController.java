package com.example.memo.api;

import com.example.memo.backend.ItemRequest;
import com.example.memo.backend.SlowBackend;
import com.example.memo.config.MemoProperties;
import com.example.memo.core.AsyncMemoizer;
import com.example.memo.core.CacheSettings;
import com.example.memo.core.EntrySnapshot;
import com.example.memo.core.ReusePolicy;
import jakarta.annotation.PostConstruct;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ItemController {

    private static final Logger log = LoggerFactory.getLogger(ItemController.class);

    private final SlowBackend backend;
    private final MemoProperties properties;
    private volatile AsyncMemoizer<ItemRequest, String> memoizer;

    public ItemController(SlowBackend backend, MemoProperties properties) {
        this.backend = backend;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        install(settings(properties.getMaxEntries(), properties.getReusePolicy()));
    }

    @GetMapping("/item")
    public CompletableFuture<String> getItem(
        @RequestParam String key,
        @RequestParam(required = false) String version
    ) {
        return memoizer.call(new ItemRequest(key, version));
    }

    @GetMapping("/config")
    public String configure(
        @RequestParam(required = false) Integer maxEntries,
        @RequestParam(required = false) Long latency,
        @RequestParam(required = false) ReusePolicy policy
    ) {
        int entries = maxEntries != null ? maxEntries : memoizer.maxEntries();
        ReusePolicy reuse = policy != null ? policy : memoizer.reusePolicy();
        if (latency != null && latency < 0) {
            throw new IllegalArgumentException("latency must be >= 0, got " + latency);
        }
        // validate everything before changing anything
        CacheSettings<ItemRequest, String> settings = settings(entries, reuse);
        if (latency != null) {
            backend.setLatencyMillis(latency);
        }
        install(settings);
        return "Configured maxEntries=" + entries + ", policy=" + reuse + ", latency=" + backend.getLatencyMillis();
    }

    @GetMapping("/stats")
    public Map<String, Object> getStats() {
        AsyncMemoizer<ItemRequest, String> current = memoizer;
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("backendRequests", backend.getRequestCount());
        stats.put("cacheSize", current.size());
        stats.put("maxEntries", current.maxEntries());
        stats.putAll(current.stats().asMap());
        return stats;
    }

    @GetMapping("/entries")
    public List<EntrySnapshot> getEntries() {
        return memoizer.snapshot();
    }

    @GetMapping("/invalidate")
    public Map<String, Object> invalidate(
        @RequestParam String key,
        @RequestParam(required = false) String version
    ) {
        boolean removed = memoizer.invalidate(new ItemRequest(key, version));
        return Map.of("key", key, "removed", removed);
    }

    @GetMapping("/reset")
    public void reset() {
        backend.resetCount();
        AsyncMemoizer<ItemRequest, String> current = memoizer;
        current.clear();
        current.stats().reset();
    }

    private CacheSettings<ItemRequest, String> settings(int maxEntries, ReusePolicy policy) {
        return CacheSettings.<ItemRequest, String>builder()
            .hasher(ItemRequest::getKey)
            .stateOf(ItemRequest::getVersion)
            .maxEntries(maxEntries)
            .shouldCache((value, request) -> value != null && !value.isEmpty())
            .reusePolicy(policy)
            .build();
    }

    private synchronized void install(CacheSettings<ItemRequest, String> settings) {
        this.memoizer = AsyncMemoizer.wrap(backend::fetch, settings);
        log.info("Memoizer configured with maxEntries={}, policy={}",
            settings.getMaxEntries(), settings.getReusePolicy());
    }
}
