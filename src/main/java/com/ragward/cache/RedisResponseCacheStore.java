package com.ragward.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragward.model.CacheEntry;
import com.ragward.model.CacheKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Optional;
import java.util.Set;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Redis-backed cache store with GZIP-compressed JSON values.
 * Key pattern: {prefix}{sha256}. Entries carry no TTL.
 */
@Slf4j
public class RedisResponseCacheStore extends AbstractResponseCacheStore {

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public RedisResponseCacheStore(
            RedisTemplate<String, byte[]> redisTemplate,
            ObjectMapper objectMapper,
            String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public String getName() {
        return "redis";
    }

    @Override
    protected Optional<CacheEntry> doGet(CacheKey key) {
        String redisKey = buildKey(key);
        try {
            byte[] compressed = redisTemplate.opsForValue().get(redisKey);
            if (compressed == null) {
                return Optional.empty();
            }
            return Optional.of(decompress(compressed).withKey(key));

        } catch (Exception e) {
            log.error("Error reading from Redis cache, treating as miss: key={}", redisKey, e);
            return Optional.empty();
        }
    }

    @Override
    protected Optional<CacheEntry> storeIfAbsent(CacheEntry candidate) {
        String redisKey = buildKey(candidate.getKey());
        try {
            byte[] compressed = compress(candidate);
            Boolean stored = redisTemplate.opsForValue().setIfAbsent(redisKey, compressed);
            if (Boolean.TRUE.equals(stored)) {
                log.debug("Stored in Redis cache: key={}, size={}B", redisKey, compressed.length);
                return Optional.empty();
            }

            byte[] existing = redisTemplate.opsForValue().get(redisKey);
            if (existing == null) {
                // Deleted externally between the two calls.
                return Optional.empty();
            }
            return Optional.of(decompress(existing).withKey(candidate.getKey()));

        } catch (Exception e) {
            // Losing a cache write must not fail the query that produced the value.
            log.error("Error storing to Redis cache: key={}", redisKey, e);
            return Optional.empty();
        }
    }

    @Override
    protected long countEntries() {
        try {
            Set<String> keys = redisTemplate.keys(keyPrefix + "*");
            return keys != null ? keys.size() : 0;
        } catch (Exception e) {
            log.warn("Unable to count Redis cache entries", e);
            return -1;
        }
    }

    private String buildKey(CacheKey key) {
        return keyPrefix + key.getDigest();
    }

    private byte[] compress(CacheEntry entry) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (GZIPOutputStream gzipOut = new GZIPOutputStream(baos)) {
            gzipOut.write(objectMapper.writeValueAsBytes(entry));
        }
        return baos.toByteArray();
    }

    private CacheEntry decompress(byte[] compressed) throws IOException {
        try (GZIPInputStream gzipIn = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return objectMapper.readValue(gzipIn.readAllBytes(), CacheEntry.class);
        }
    }
}
