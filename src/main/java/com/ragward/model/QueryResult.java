package com.ragward.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one dispatch cycle with cache provenance.
 */
@Value
@Builder
public class QueryResult {

    String response;

    QueryMode mode;

    /**
     * {@code null} for canned bypass replies, which are never keyed.
     */
    CacheKey cacheKey;

    boolean cacheHit;

    /**
     * True when this caller joined another caller's in-flight provider call.
     */
    boolean shared;
}
