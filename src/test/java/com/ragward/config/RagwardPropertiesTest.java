package com.ragward.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RagwardProperties binding and defaults.
 */
class RagwardPropertiesTest {

    @Test
    void testDefaultsWhenNothingIsSet() {
        RagwardProperties properties = bind(Map.of());

        assertEquals(RagwardProperties.ProviderType.AZURE_OPENAI, properties.getProvider().getType());
        assertEquals("gpt-4o", properties.getProvider().getDeployment());
        assertEquals(3072, properties.getProvider().getEmbeddingDimensions());
        assertEquals(Duration.ofSeconds(1), properties.getRetry().getBaseDelay());
        assertEquals(5, properties.getRetry().getMaxAttempts());
        assertEquals(Duration.ofSeconds(60), properties.getTimeout().getDefaultWait());
        assertEquals(RagwardProperties.StoreType.MEMORY, properties.getCache().getStore());
        assertEquals(List.of("hello", "hi", "test", "ping"), properties.getSelector().getBypassKeywords());
        assertEquals(RagwardProperties.BypassStrategy.CANNED, properties.getBypass().getStrategy());
        assertEquals(2, properties.getBatch().getMaxConcurrentDocuments());
        assertEquals(20, properties.getEmbedding().getBatchSize());
    }

    @Test
    void testOverrides() {
        RagwardProperties properties = bind(Map.of(
                "ragward.provider.type", "gemini",
                "ragward.provider.embedding-dimensions", "768",
                "ragward.retry.max-attempts", "3",
                "ragward.timeout.default-wait", "30s",
                "ragward.cache.store", "file",
                "ragward.bypass.strategy", "direct"));

        assertEquals(RagwardProperties.ProviderType.GEMINI, properties.getProvider().getType());
        assertEquals(768, properties.getProvider().getEmbeddingDimensions());
        assertEquals(3, properties.getRetry().getMaxAttempts());
        assertEquals(Duration.ofSeconds(30), properties.getTimeout().getDefaultWait());
        assertEquals(RagwardProperties.StoreType.FILE, properties.getCache().getStore());
        assertEquals(RagwardProperties.BypassStrategy.DIRECT, properties.getBypass().getStrategy());
    }

    @Test
    void testTimeoutResolution() {
        RagwardProperties.TimeoutConfig timeout = RagwardProperties.TimeoutConfig.defaults();

        assertEquals(Duration.ofSeconds(60), timeout.resolve(null));
        assertEquals(Duration.ofSeconds(60), timeout.resolve(Duration.ZERO));
        assertEquals(Duration.ofSeconds(10), timeout.resolve(Duration.ofSeconds(10)));
        assertEquals(Duration.ofSeconds(120), timeout.resolve(Duration.ofMinutes(10)));
    }

    @Test
    void testApiKeyNotPrinted() {
        RagwardProperties properties = bind(Map.of("ragward.provider.api-key", "super-secret"));

        assertFalse(properties.toString().contains("super-secret"));
    }

    private RagwardProperties bind(Map<String, String> values) {
        Binder binder = new Binder(new MapConfigurationPropertySource(values));
        return binder.bindOrCreate("ragward", RagwardProperties.class);
    }
}
