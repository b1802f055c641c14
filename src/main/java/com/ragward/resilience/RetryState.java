package com.ragward.resilience;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot of one provider call's retry loop, published before each backoff sleep.
 */
@Value
public class RetryState {

    String operation;

    /**
     * Number of the attempt that just failed, starting at 1.
     */
    int attempt;

    Duration nextDelay;

    Instant deadline;

    Throwable lastError;
}
