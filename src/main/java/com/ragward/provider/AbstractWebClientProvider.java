package com.ragward.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.ragward.config.RagwardProperties;
import com.ragward.exception.PermanentProviderException;
import com.ragward.resilience.ProviderErrorClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Abstract base class for HTTP providers with common functionality.
 *
 * Retries are not done here; the retry controller owns them. Providers only translate transport
 * failures into the mediation error taxonomy.
 */
@Slf4j
public abstract class AbstractWebClientProvider implements TextProvider, EmbeddingProvider {

    protected final WebClient webClient;
    protected final RagwardProperties.ProviderConfig config;

    protected AbstractWebClientProvider(WebClient webClient, RagwardProperties.ProviderConfig config) {
        this.webClient = webClient;
        this.config = config;
    }

    @Override
    public int getDimensions() {
        return config.getEmbeddingDimensions();
    }

    /**
     * Map transport errors onto the mediation taxonomy.
     */
    protected <T> Mono<T> classifyErrors(Mono<T> request) {
        return request
                .onErrorMap(error -> ProviderErrorClassifier.classify(getName(), error))
                .doOnCancel(() -> log.debug("Request to {} cancelled", getName()));
    }

    /**
     * Check that the provider has what it needs to make a call.
     */
    protected Mono<Void> requireConfigured() {
        if (config.getEndpoint() == null || config.getEndpoint().isBlank()) {
            return Mono.error(new PermanentProviderException(getName(), getName() + " endpoint is not configured"));
        }
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            return Mono.error(new PermanentProviderException(getName(), getName() + " API key is not configured"));
        }
        return Mono.empty();
    }

    protected String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    protected float[] toVector(JsonNode values) {
        if (values == null || !values.isArray()) {
            throw new PermanentProviderException(getName(), getName() + " returned an embedding without values");
        }
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) values.get(i).asDouble();
        }
        return vector;
    }

    protected List<float[]> requireSize(List<float[]> vectors, int expected) {
        if (vectors.size() != expected) {
            throw new PermanentProviderException(getName(),
                    getName() + " returned " + vectors.size() + " embeddings for " + expected + " inputs");
        }
        return new ArrayList<>(vectors);
    }
}
