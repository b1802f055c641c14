package com.ragward.resilience;

import com.ragward.config.RagwardProperties;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Exponential backoff policy for provider calls.
 *
 * For retry N (starting at 1) the delay is {@code min(baseDelay * 2^(N-1), maxDelay)}, without
 * jitter, so successive delays strictly increase until they plateau at the cap.
 */
@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    Duration baseDelay;

    Duration maxDelay;

    /**
     * Total attempts including the first one.
     */
    int maxAttempts;

    /**
     * Bound on a single attempt; {@code null} or zero disables the per-attempt timeout.
     */
    Duration attemptTimeout;

    public static RetryPolicy from(RagwardProperties.RetryConfig config) {
        return RetryPolicy.builder()
                .baseDelay(config.getBaseDelay())
                .maxDelay(config.getMaxDelay())
                .maxAttempts(config.getMaxAttempts())
                .attemptTimeout(config.getAttemptTimeout())
                .build();
    }

    /**
     * Delay to wait before the given retry.
     *
     * @param retryNumber 1 for the first retry (after the first failed attempt)
     * @return backoff delay, never above {@link #getMaxDelay()}
     */
    public Duration delayBeforeRetry(int retryNumber) {
        if (retryNumber < 1) {
            throw new IllegalArgumentException("retryNumber must be >= 1: " + retryNumber);
        }
        long baseMillis = baseDelay.toMillis();
        long capMillis = maxDelay.toMillis();

        int shift = retryNumber - 1;
        if (shift >= 62 || baseMillis > (capMillis >> shift)) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.min(baseMillis << shift, capMillis));
    }

    public boolean hasAttemptTimeout() {
        return attemptTimeout != null && !attemptTimeout.isZero() && !attemptTimeout.isNegative();
    }
}
