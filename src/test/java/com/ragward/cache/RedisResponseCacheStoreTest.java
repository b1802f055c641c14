package com.ragward.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragward.config.JacksonConfiguration;
import com.ragward.model.CacheEntry;
import com.ragward.model.CacheKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests for RedisResponseCacheStore against a mocked template.
 */
class RedisResponseCacheStoreTest {

    private static final String PREFIX = "ragward:response:";
    private static final CacheKey KEY = CacheKey.of("c".repeat(64));

    private ValueOperations<String, byte[]> valueOps;
    private RedisResponseCacheStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        RedisTemplate<String, byte[]> template = mock(RedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        when(template.opsForValue()).thenReturn(valueOps);

        ObjectMapper objectMapper = JacksonConfiguration.createObjectMapper();
        store = new RedisResponseCacheStore(template, objectMapper, PREFIX);
    }

    @Test
    void testPutCompressesAndReadsBack() {
        when(valueOps.setIfAbsent(eq(PREFIX + KEY.getDigest()), any(byte[].class))).thenReturn(true);

        store.put(KEY, "Hall sensors detect magnetic fields.");

        ArgumentCaptor<byte[]> written = ArgumentCaptor.forClass(byte[].class);
        verify(valueOps).setIfAbsent(eq(PREFIX + KEY.getDigest()), written.capture());
        // GZIP magic number
        assertEquals((byte) 0x1f, written.getValue()[0]);
        assertEquals((byte) 0x8b, written.getValue()[1]);

        when(valueOps.get(PREFIX + KEY.getDigest())).thenReturn(written.getValue());
        Optional<CacheEntry> entry = store.get(KEY);
        assertTrue(entry.isPresent());
        assertEquals("Hall sensors detect magnetic fields.", entry.get().getValue());
        assertEquals(KEY, entry.get().getKey());
    }

    @Test
    void testExistingDifferentValueCountsAnomaly() {
        when(valueOps.setIfAbsent(anyString(), any(byte[].class))).thenReturn(true);
        store.put(KEY, "first");

        ArgumentCaptor<byte[]> written = ArgumentCaptor.forClass(byte[].class);
        verify(valueOps).setIfAbsent(eq(PREFIX + KEY.getDigest()), written.capture());
        when(valueOps.get(PREFIX + KEY.getDigest())).thenReturn(written.getValue());
        when(valueOps.setIfAbsent(anyString(), any(byte[].class))).thenReturn(false);

        store.put(KEY, "second");

        assertEquals(1, store.getStats().getAnomalies());
        assertEquals("first", store.get(KEY).orElseThrow().getValue());
    }

    @Test
    void testRedisFailureIsTreatedAsMiss() {
        when(valueOps.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));

        assertTrue(store.get(KEY).isEmpty());
        assertEquals(1, store.getStats().getMisses());
    }

    @Test
    void testRedisWriteFailureDoesNotThrow() {
        when(valueOps.setIfAbsent(anyString(), any(byte[].class)))
                .thenThrow(new RedisConnectionFailureException("down"));

        assertDoesNotThrow(() -> store.put(KEY, "answer"));
    }
}
