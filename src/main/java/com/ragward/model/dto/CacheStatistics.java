package com.ragward.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response cache statistics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    private String store;
    private long entries;
    private long hits;
    private long misses;

    /**
     * Puts that carried a different value for an already stored key.
     */
    private long anomalies;

    private double hitRate;
}
