package com.ragward.controller;

import com.ragward.cache.CaffeineResponseCacheStore;
import com.ragward.model.CacheKey;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

/**
 * Tests for CacheController.
 */
class CacheControllerTest {

    @Test
    void testStats() {
        CaffeineResponseCacheStore store = new CaffeineResponseCacheStore();
        CacheKey key = CacheKey.of("f".repeat(64));
        store.put(key, "first");
        store.put(key, "second");
        store.get(key);

        WebTestClient.bindToController(new CacheController(store)).build()
                .get().uri("/v1/cache/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.store").isEqualTo("memory")
                .jsonPath("$.entries").isEqualTo(1)
                .jsonPath("$.hits").isEqualTo(1)
                .jsonPath("$.anomalies").isEqualTo(1);
    }
}
