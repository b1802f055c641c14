package com.ragward.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;

/**
 * Completed response owned by the cache store. Never updated in place.
 *
 * Serialized as {@code {"return": ..., "create_time": ...}}; the key lives outside the record.
 */
@Value
public class CacheEntry {

    @JsonIgnore
    CacheKey key;

    @JsonProperty("return")
    String value;

    @JsonProperty("create_time")
    Instant createdAt;

    @JsonCreator
    static CacheEntry fromJson(@JsonProperty("return") String value,
                               @JsonProperty("create_time") Instant createdAt) {
        return new CacheEntry(null, value, createdAt);
    }

    public static CacheEntry create(CacheKey key, String value) {
        return new CacheEntry(key, value, Instant.now());
    }

    public CacheEntry withKey(CacheKey key) {
        return new CacheEntry(key, value, createdAt);
    }
}
