package com.ragward.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Retrieval/answering strategy for one query.
 *
 * Retrieval breadth of each mode belongs to the retrieval collaborator;
 * mediation only routes by mode and includes it in the cache key.
 */
public enum QueryMode {
    /**
     * Skip retrieval, answer directly or with a canned reply.
     */
    BYPASS,

    /**
     * Entity-centred retrieval around the question.
     */
    LOCAL,

    /**
     * Relationship/community-level retrieval.
     */
    GLOBAL,

    /**
     * Local and global retrieval combined (default for real questions).
     */
    HYBRID,

    /**
     * Plain vector search without graph context.
     */
    NAIVE;

    /**
     * Wire name, lower case.
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static QueryMode fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return QueryMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown query mode: " + value, e);
        }
    }
}
