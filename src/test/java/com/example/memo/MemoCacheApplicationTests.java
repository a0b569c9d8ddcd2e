package com.example.memo;

import com.example.memo.api.ItemController;
import com.example.memo.config.MemoProperties;
import com.example.memo.core.ReusePolicy;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "memo.max-entries=3",
                "memo.reuse-policy=RESOLVED_ONLY",
                "memo.backend.latency-ms=0"
        })
class MemoCacheApplicationTests {

    @Autowired
    private MemoProperties properties;

    @Autowired
    private ItemController controller;

    @Test
    void bindsMemoProperties() {
        assertEquals(3, properties.getMaxEntries());
        assertEquals(ReusePolicy.RESOLVED_ONLY, properties.getReusePolicy());
        assertEquals(0, properties.getBackend().getLatencyMs());
        assertEquals(3, controller.getStats().get("maxEntries"));
    }
}
