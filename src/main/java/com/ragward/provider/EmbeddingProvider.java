package com.ragward.provider;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Embedding capability of a provider.
 */
public interface EmbeddingProvider {

    String getName();

    /**
     * Embedding model or deployment identifier, part of the embedding cache key.
     */
    String getEmbeddingModel();

    /**
     * Get embedding dimensions.
     *
     * @return number of dimensions in each output vector
     */
    int getDimensions();

    /**
     * Embed a batch of texts.
     *
     * @param batch input texts
     * @return one vector per input, in input order
     */
    Mono<List<float[]>> invokeEmbedding(List<String> batch);
}
