package com.ragward.cache;

import com.ragward.model.CacheEntry;
import com.ragward.model.CacheKey;
import com.ragward.model.dto.CacheStatistics;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;

/**
 * Shared put-if-absent and anomaly bookkeeping for cache stores.
 */
@Slf4j
public abstract class AbstractResponseCacheStore implements ResponseCacheStore {

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder anomalies = new LongAdder();

    @Override
    public Optional<CacheEntry> get(CacheKey key) {
        Optional<CacheEntry> entry = doGet(key);
        if (entry.isPresent()) {
            hits.increment();
            log.debug("Cache HIT ({}): key={}", getName(), key);
        } else {
            misses.increment();
            log.debug("Cache MISS ({}): key={}", getName(), key);
        }
        return entry;
    }

    @Override
    public void put(CacheKey key, String value) {
        Objects.requireNonNull(value, "value");
        CacheEntry candidate = CacheEntry.create(key, value);

        Optional<CacheEntry> existing = storeIfAbsent(candidate);
        if (existing.isEmpty()) {
            log.debug("Stored in cache ({}): key={}, size={} chars", getName(), key, value.length());
            return;
        }

        if (existing.get().getValue().equals(value)) {
            log.debug("Idempotent put ignored ({}): key={}", getName(), key);
        } else {
            anomalies.increment();
            log.warn("Cache anomaly ({}): key={} already holds a different value "
                            + "(stored {} chars at {}, offered {} chars); keeping stored entry",
                    getName(), key, existing.get().getValue().length(),
                    existing.get().getCreatedAt(), value.length());
        }
    }

    @Override
    public CacheStatistics getStats() {
        long hitCount = hits.sum();
        long missCount = misses.sum();
        long lookups = hitCount + missCount;

        return CacheStatistics.builder()
                .store(getName())
                .entries(countEntries())
                .hits(hitCount)
                .misses(missCount)
                .anomalies(anomalies.sum())
                .hitRate(lookups > 0 ? (double) hitCount / lookups : 0.0)
                .build();
    }

    /**
     * Read the entry for a key without touching statistics.
     */
    protected abstract Optional<CacheEntry> doGet(CacheKey key);

    /**
     * Atomically store the entry unless the key is already present.
     *
     * @return the entry already stored under the key, or empty if the candidate was stored
     */
    protected abstract Optional<CacheEntry> storeIfAbsent(CacheEntry candidate);

    /**
     * Number of stored entries, or -1 when the backend cannot tell cheaply.
     */
    protected abstract long countEntries();
}
