package com.ragward.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * One user question. Immutable once created.
 */
@Value
@Builder(toBuilder = true)
public class QueryRequest {

    String rawText;

    /**
     * Caller-pinned mode; {@code null} lets the mode selector decide.
     */
    QueryMode mode;

    /**
     * Opaque token identifying the indexed corpus the answer depends on.
     */
    @Builder.Default
    String corpusVersion = "";

    /**
     * User-visible deadline; {@code null} means the configured default.
     */
    Duration maxWait;

    @Builder.Default
    ModelParameters parameters = ModelParameters.defaults();

    public static QueryRequest of(String rawText) {
        return QueryRequest.builder().rawText(rawText).build();
    }
}
