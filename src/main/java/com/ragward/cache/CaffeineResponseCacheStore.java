package com.ragward.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.ragward.model.CacheEntry;
import com.ragward.model.CacheKey;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * In-process cache store backed by an unbounded Caffeine cache.
 */
@Slf4j
public class CaffeineResponseCacheStore extends AbstractResponseCacheStore {

    private final Cache<String, CacheEntry> cache;

    public CaffeineResponseCacheStore() {
        this.cache = Caffeine.newBuilder().build();
        log.info("Initialized in-memory response cache (no eviction)");
    }

    @Override
    public String getName() {
        return "memory";
    }

    @Override
    protected Optional<CacheEntry> doGet(CacheKey key) {
        return Optional.ofNullable(cache.getIfPresent(key.getDigest()));
    }

    @Override
    protected Optional<CacheEntry> storeIfAbsent(CacheEntry candidate) {
        return Optional.ofNullable(cache.asMap().putIfAbsent(candidate.getKey().getDigest(), candidate));
    }

    @Override
    protected long countEntries() {
        return cache.estimatedSize();
    }
}
