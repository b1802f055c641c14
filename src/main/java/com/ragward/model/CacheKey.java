package com.ragward.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Deterministic digest identifying a semantically equivalent request.
 */
@Value
public class CacheKey {

    @NonNull
    String digest;

    public static CacheKey of(String digest) {
        return new CacheKey(digest);
    }

    @Override
    public String toString() {
        return digest;
    }
}
