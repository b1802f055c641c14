package com.ragward.service;

import com.ragward.model.ModelParameters;
import com.ragward.model.QueryMode;
import reactor.core.publisher.Mono;

/**
 * The opaque provider-facing call made for one cache miss.
 */
public interface QueryExecutor {

    Mono<String> execute(String question, QueryMode mode, ModelParameters parameters);

    /**
     * Name of the provider behind this executor, used to label its errors.
     */
    default String getProviderName() {
        return "provider";
    }
}
