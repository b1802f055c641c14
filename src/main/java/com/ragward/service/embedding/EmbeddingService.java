package com.ragward.service.embedding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragward.cache.ResponseCacheStore;
import com.ragward.config.RagwardProperties;
import com.ragward.exception.InputException;
import com.ragward.exception.PermanentProviderException;
import com.ragward.model.CacheEntry;
import com.ragward.model.CacheKey;
import com.ragward.provider.EmbeddingProvider;
import com.ragward.resilience.RetryController;
import com.ragward.resilience.RetryPolicy;
import com.ragward.resilience.TimeoutSupervisor;
import com.ragward.service.fingerprint.RequestFingerprinter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Embeds texts with per-text caching.
 *
 * Only texts without a cached vector reach the provider, de-duplicated and split into batches.
 * Batches run one after another, each under its own Timeout(Retry(...)) envelope.
 */
@Slf4j
public class EmbeddingService {

    private final EmbeddingProvider provider;
    private final RequestFingerprinter fingerprinter;
    private final ResponseCacheStore cacheStore;
    private final RetryController retryController;
    private final TimeoutSupervisor timeoutSupervisor;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;
    private final Duration batchWait;
    private final int batchSize;
    private final Clock clock;

    public EmbeddingService(
            EmbeddingProvider provider,
            RequestFingerprinter fingerprinter,
            ResponseCacheStore cacheStore,
            RetryController retryController,
            TimeoutSupervisor timeoutSupervisor,
            ObjectMapper objectMapper,
            RagwardProperties properties,
            Clock clock) {
        this.provider = provider;
        this.fingerprinter = fingerprinter;
        this.cacheStore = cacheStore;
        this.retryController = retryController;
        this.timeoutSupervisor = timeoutSupervisor;
        this.objectMapper = objectMapper;
        this.retryPolicy = RetryPolicy.from(properties.getRetry());
        this.batchWait = properties.getTimeout().getDefaultWait();
        this.batchSize = Math.max(1, properties.getEmbedding().getBatchSize());
        this.clock = clock;
    }

    /**
     * Embed texts.
     *
     * @param texts non-empty list of non-blank texts
     * @return one vector per input text, in input order
     */
    public Mono<List<float[]>> embed(List<String> texts) {
        return Mono.defer(() -> {
            if (texts == null || texts.isEmpty()) {
                return Mono.error(new InputException("At least one text is required"));
            }
            for (int i = 0; i < texts.size(); i++) {
                if (texts.get(i) == null || texts.get(i).isBlank()) {
                    return Mono.error(new InputException("Text at index " + i + " must not be empty"));
                }
            }

            Map<String, float[]> resolved = new ConcurrentHashMap<>();
            LinkedHashSet<String> misses = new LinkedHashSet<>();
            for (String text : texts) {
                if (resolved.containsKey(text) || misses.contains(text)) {
                    continue;
                }
                Optional<float[]> cached = lookup(text);
                if (cached.isPresent()) {
                    resolved.put(text, cached.get());
                } else {
                    misses.add(text);
                }
            }

            log.info("Embedding {} texts: {} cached, {} to provider {}",
                    texts.size(), texts.size() - countMisses(texts, misses), misses.size(), provider.getName());

            if (misses.isEmpty()) {
                return Mono.just(assemble(texts, resolved));
            }

            return Flux.fromIterable(partition(new ArrayList<>(misses)))
                    .concatMap(batch -> embedBatch(batch)
                            .doOnNext(vectors -> storeAll(batch, vectors, resolved)))
                    .then(Mono.fromCallable(() -> assemble(texts, resolved)));
        });
    }

    private Mono<List<float[]>> embedBatch(List<String> batch) {
        AtomicReference<Throwable> lastError = new AtomicReference<>();

        return timeoutSupervisor.runWithTimeout(
                retryController.callWithRetry(
                        "embedding[" + provider.getName() + "]",
                        () -> provider.invokeEmbedding(batch),
                        retryPolicy,
                        clock.instant().plus(batchWait),
                        state -> lastError.set(state.getLastError())),
                batchWait,
                lastError::get);
    }

    private void storeAll(List<String> batch, List<float[]> vectors, Map<String, float[]> resolved) {
        for (int i = 0; i < batch.size(); i++) {
            float[] vector = vectors.get(i);
            if (vector.length != provider.getDimensions()) {
                throw new PermanentProviderException(provider.getName(),
                        "Expected " + provider.getDimensions() + "-dimensional embeddings, got " + vector.length);
            }
            String text = batch.get(i);
            resolved.put(text, vector);
            cacheStore.put(keyFor(text), encode(vector));
        }
    }

    private Optional<float[]> lookup(String text) {
        Optional<CacheEntry> entry = cacheStore.get(keyFor(text));
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        try {
            float[] vector = objectMapper.readValue(entry.get().getValue(), float[].class);
            if (vector.length != provider.getDimensions()) {
                log.warn("Ignoring cached embedding with {} dimensions, expected {}",
                        vector.length, provider.getDimensions());
                return Optional.empty();
            }
            return Optional.of(vector);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable cached embedding: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private CacheKey keyFor(String text) {
        return fingerprinter.fingerprintEmbedding(
                provider.getName(), provider.getEmbeddingModel(), provider.getDimensions(), text);
    }

    private String encode(float[] vector) {
        try {
            return objectMapper.writeValueAsString(vector);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode embedding", e);
        }
    }

    private List<List<String>> partition(List<String> texts) {
        List<List<String>> batches = new ArrayList<>();
        for (int start = 0; start < texts.size(); start += batchSize) {
            batches.add(texts.subList(start, Math.min(start + batchSize, texts.size())));
        }
        return batches;
    }

    private long countMisses(List<String> texts, LinkedHashSet<String> misses) {
        return texts.stream().filter(misses::contains).count();
    }

    private List<float[]> assemble(List<String> texts, Map<String, float[]> resolved) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(resolved.get(text));
        }
        return vectors;
    }
}
