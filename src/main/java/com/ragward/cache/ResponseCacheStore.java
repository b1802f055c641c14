package com.ragward.cache;

import com.ragward.model.CacheEntry;
import com.ragward.model.CacheKey;
import com.ragward.model.dto.CacheStatistics;

import java.util.Optional;

/**
 * Key-value persistence for completed responses.
 *
 * Entries are immutable: a put for an existing key with an equal value is a no-op, and a put
 * with a different value is reported as an anomaly and does not replace the stored entry.
 * No eviction happens here; retention is an external concern.
 */
public interface ResponseCacheStore {

    /**
     * Store name for logs and statistics (e.g., "memory", "redis", "file").
     */
    String getName();

    Optional<CacheEntry> get(CacheKey key);

    void put(CacheKey key, String value);

    CacheStatistics getStats();
}
