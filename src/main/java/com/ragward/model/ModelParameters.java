package com.ragward.model;

import lombok.Builder;
import lombok.Value;

/**
 * Generation parameters forwarded to the text provider and folded into the cache key.
 */
@Value
@Builder(toBuilder = true)
public class ModelParameters {

    @Builder.Default
    double temperature = 0.0;

    @Builder.Default
    int maxTokens = 4000;

    @Builder.Default
    double topP = 1.0;

    public static ModelParameters defaults() {
        return ModelParameters.builder().build();
    }
}
