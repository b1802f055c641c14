package com.ragward.service;

import com.ragward.model.QueryMode;
import reactor.core.publisher.Mono;

/**
 * Retrieval collaborator that supplies document context for a question.
 *
 * Knowledge-graph and vector search live outside this service; implementations decide what each
 * mode's retrieval breadth means.
 */
public interface ContextRetriever {

    /**
     * Retrieve context for a question.
     *
     * @param question trimmed question text
     * @param mode     selected mode (never BYPASS)
     * @return context text, empty when nothing relevant was found
     */
    Mono<String> retrieve(String question, QueryMode mode);

    /**
     * Retriever that never finds context, used when no retrieval backend is wired in.
     */
    static ContextRetriever none() {
        return (question, mode) -> Mono.just("");
    }
}
