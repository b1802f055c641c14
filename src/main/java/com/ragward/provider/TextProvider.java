package com.ragward.provider;

import com.ragward.model.ModelParameters;
import reactor.core.publisher.Mono;

/**
 * Text-generation capability of a provider.
 *
 * Implementations resolve endpoint, credentials and deployment from configuration and must honour
 * cancellation: cancelling the returned Mono aborts the underlying request.
 */
public interface TextProvider {

    /**
     * Get provider name (e.g., "azure-openai", "gemini").
     *
     * @return provider name
     */
    String getName();

    /**
     * Generate text for a prompt.
     *
     * @param prompt     full prompt
     * @param parameters generation parameters
     * @return generated text, or a {@link com.ragward.exception.ProviderException} subtype on failure
     */
    Mono<String> invokeText(String prompt, ModelParameters parameters);
}
