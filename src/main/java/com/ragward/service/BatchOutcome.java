package com.ragward.service;

import com.ragward.model.QueryResult;
import lombok.Value;

/**
 * Outcome of one request inside a batch dispatch.
 */
@Value
public class BatchOutcome {

    int index;

    QueryResult result;

    Throwable error;

    public static BatchOutcome success(int index, QueryResult result) {
        return new BatchOutcome(index, result, null);
    }

    public static BatchOutcome failure(int index, Throwable error) {
        return new BatchOutcome(index, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
