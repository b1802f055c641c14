package com.ragward.config;

import lombok.Getter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Configuration properties for Ragward.
 *
 * Bound once at startup through constructors and never mutated afterwards;
 * components receive the sections they need by reference.
 */
@Getter
@ToString
@ConfigurationProperties(prefix = "ragward")
public class RagwardProperties {

    private final ProviderConfig provider;
    private final RetryConfig retry;
    private final TimeoutConfig timeout;
    private final CacheConfig cache;
    private final SelectorConfig selector;
    private final BypassConfig bypass;
    private final BatchConfig batch;
    private final EmbeddingConfig embedding;

    public RagwardProperties(
            @DefaultValue ProviderConfig provider,
            @DefaultValue RetryConfig retry,
            @DefaultValue TimeoutConfig timeout,
            @DefaultValue CacheConfig cache,
            @DefaultValue SelectorConfig selector,
            @DefaultValue BypassConfig bypass,
            @DefaultValue BatchConfig batch,
            @DefaultValue EmbeddingConfig embedding) {
        this.provider = provider;
        this.retry = retry;
        this.timeout = timeout;
        this.cache = cache;
        this.selector = selector;
        this.bypass = bypass;
        this.batch = batch;
        this.embedding = embedding;
    }

    /**
     * Defaults for every section, as if no property had been set.
     */
    public static RagwardProperties defaults() {
        return new RagwardProperties(
                ProviderConfig.defaults(),
                RetryConfig.defaults(),
                TimeoutConfig.defaults(),
                CacheConfig.defaults(),
                SelectorConfig.defaults(),
                BypassConfig.defaults(),
                new BatchConfig(2),
                EmbeddingConfig.defaults());
    }

    public enum ProviderType {
        AZURE_OPENAI,
        GEMINI
    }

    @Getter
    @ToString(exclude = "apiKey")
    public static class ProviderConfig {
        private final ProviderType type;
        private final String endpoint;
        private final String apiKey;
        private final String deployment;
        private final String apiVersion;
        private final String embeddingDeployment;
        private final String embeddingApiVersion;
        private final int embeddingDimensions;

        public ProviderConfig(
                @DefaultValue("AZURE_OPENAI") ProviderType type,
                String endpoint,
                String apiKey,
                @DefaultValue("gpt-4o") String deployment,
                @DefaultValue("2024-12-01-preview") String apiVersion,
                @DefaultValue("text-embedding-3-large") String embeddingDeployment,
                @DefaultValue("2024-02-01") String embeddingApiVersion,
                @DefaultValue("3072") int embeddingDimensions) {
            this.type = type;
            this.endpoint = endpoint;
            this.apiKey = apiKey;
            this.deployment = deployment;
            this.apiVersion = apiVersion;
            this.embeddingDeployment = embeddingDeployment;
            this.embeddingApiVersion = embeddingApiVersion;
            this.embeddingDimensions = embeddingDimensions;
        }

        public static ProviderConfig defaults() {
            return new ProviderConfig(ProviderType.AZURE_OPENAI, null, null, "gpt-4o",
                    "2024-12-01-preview", "text-embedding-3-large", "2024-02-01", 3072);
        }
    }

    @Getter
    @ToString
    public static class RetryConfig {
        private final Duration baseDelay;
        private final Duration maxDelay;
        private final int maxAttempts;
        private final Duration attemptTimeout;

        public RetryConfig(
                @DefaultValue("1s") Duration baseDelay,
                @DefaultValue("10s") Duration maxDelay,
                @DefaultValue("5") int maxAttempts,
                @DefaultValue("30s") Duration attemptTimeout) {
            this.baseDelay = baseDelay;
            this.maxDelay = maxDelay;
            this.maxAttempts = maxAttempts;
            this.attemptTimeout = attemptTimeout;
        }

        public static RetryConfig defaults() {
            return new RetryConfig(Duration.ofSeconds(1), Duration.ofSeconds(10), 5, Duration.ofSeconds(30));
        }
    }

    @Getter
    @ToString
    public static class TimeoutConfig {
        private final Duration defaultWait;
        private final Duration maxWait;

        public TimeoutConfig(
                @DefaultValue("60s") Duration defaultWait,
                @DefaultValue("120s") Duration maxWait) {
            this.defaultWait = defaultWait;
            this.maxWait = maxWait;
        }

        public static TimeoutConfig defaults() {
            return new TimeoutConfig(Duration.ofSeconds(60), Duration.ofSeconds(120));
        }

        /**
         * Resolve the user-visible wait for one query: default when absent, clamped to the maximum.
         */
        public Duration resolve(Duration requested) {
            if (requested == null || requested.isZero() || requested.isNegative()) {
                return defaultWait;
            }
            return requested.compareTo(maxWait) > 0 ? maxWait : requested;
        }
    }

    public enum StoreType {
        MEMORY,
        REDIS,
        FILE
    }

    @Getter
    @ToString
    public static class CacheConfig {
        private final StoreType store;
        private final Path filePath;
        private final String redisKeyPrefix;

        public CacheConfig(
                @DefaultValue("MEMORY") StoreType store,
                @DefaultValue("rag_storage/kv_store_llm_response_cache.json") Path filePath,
                @DefaultValue("ragward:response:") String redisKeyPrefix) {
            this.store = store;
            this.filePath = filePath;
            this.redisKeyPrefix = redisKeyPrefix;
        }

        public static CacheConfig defaults() {
            return new CacheConfig(StoreType.MEMORY,
                    Path.of("rag_storage/kv_store_llm_response_cache.json"), "ragward:response:");
        }
    }

    @Getter
    @ToString
    public static class SelectorConfig {
        private final List<String> bypassKeywords;
        private final int shortTextLength;

        public SelectorConfig(
                @DefaultValue({"hello", "hi", "test", "ping"}) List<String> bypassKeywords,
                @DefaultValue("3") int shortTextLength) {
            this.bypassKeywords = List.copyOf(bypassKeywords);
            this.shortTextLength = shortTextLength;
        }

        public static SelectorConfig defaults() {
            return new SelectorConfig(List.of("hello", "hi", "test", "ping"), 3);
        }
    }

    public enum BypassStrategy {
        /**
         * Answer with a fixed reply, no cache or provider interaction.
         */
        CANNED,

        /**
         * Ask the provider directly, without retrieval context.
         */
        DIRECT
    }

    @Getter
    @ToString
    public static class BypassConfig {
        private final BypassStrategy strategy;
        private final String reply;

        public BypassConfig(
                @DefaultValue("CANNED") BypassStrategy strategy,
                @DefaultValue("Hello! Ask me a question about your documents.") String reply) {
            this.strategy = strategy;
            this.reply = reply;
        }

        public static BypassConfig defaults() {
            return new BypassConfig(BypassStrategy.CANNED, "Hello! Ask me a question about your documents.");
        }
    }

    @Getter
    @ToString
    public static class BatchConfig {
        private final int maxConcurrentDocuments;

        public BatchConfig(@DefaultValue("2") int maxConcurrentDocuments) {
            this.maxConcurrentDocuments = maxConcurrentDocuments;
        }
    }

    @Getter
    @ToString
    public static class EmbeddingConfig {
        private final int batchSize;

        public EmbeddingConfig(@DefaultValue("20") int batchSize) {
            this.batchSize = batchSize;
        }

        public static EmbeddingConfig defaults() {
            return new EmbeddingConfig(20);
        }
    }
}
