package com.ragward.controller;

import com.ragward.cache.ResponseCacheStore;
import com.ragward.model.dto.CacheStatistics;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Cache statistics.
 */
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final ResponseCacheStore cacheStore;

    public CacheController(ResponseCacheStore cacheStore) {
        this.cacheStore = cacheStore;
    }

    @GetMapping("/stats")
    public ResponseEntity<CacheStatistics> getStats() {
        return ResponseEntity.ok(cacheStore.getStats());
    }
}
