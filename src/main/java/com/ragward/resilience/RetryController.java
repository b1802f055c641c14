package com.ragward.resilience;

import com.ragward.exception.MediationException;
import com.ragward.exception.TransientProviderException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Wraps a provider call with rate-limit aware exponential backoff.
 *
 * Retries only errors whose kind is retryable (rate limit, transient). Gives up on the first
 * non-retryable error, after {@code maxAttempts}, or when the next backoff would end past the
 * deadline. In every case the last concrete error is propagated unchanged.
 */
@Slf4j
public class RetryController {

    private final Clock clock;
    private final Scheduler scheduler;

    public RetryController(Clock clock, Scheduler scheduler) {
        this.clock = clock;
        this.scheduler = scheduler;
    }

    public <T> Mono<T> callWithRetry(String operation, Supplier<Mono<T>> call, RetryPolicy policy, Instant deadline) {
        return callWithRetry(operation, call, policy, deadline, state -> {
        });
    }

    /**
     * Execute the call, retrying retryable failures with backoff.
     *
     * @param operation label for logs
     * @param call      supplier producing a fresh provider call per attempt
     * @param policy    backoff policy
     * @param deadline  no retry is scheduled whose delay would end after this instant
     * @param observer  notified before every backoff sleep
     * @return the first successful value, or the last error encountered
     */
    public <T> Mono<T> callWithRetry(
            String operation,
            Supplier<Mono<T>> call,
            RetryPolicy policy,
            Instant deadline,
            Consumer<RetryState> observer) {
        Objects.requireNonNull(deadline, "deadline");

        return Mono.defer(() -> attempt(operation, call, policy))
                .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                    Throwable failure = signal.failure();
                    int failedAttempt = (int) signal.totalRetries() + 1;

                    if (!isRetryable(failure)) {
                        log.debug("{}: attempt {} failed with non-retryable error: {}",
                                operation, failedAttempt, failure.getMessage());
                        return Mono.<Long>error(failure);
                    }

                    if (failedAttempt >= policy.getMaxAttempts()) {
                        log.warn("{}: giving up after {} attempts: {}", operation, failedAttempt, failure.getMessage());
                        return Mono.<Long>error(failure);
                    }

                    Duration delay = policy.delayBeforeRetry(failedAttempt);
                    if (clock.instant().plus(delay).isAfter(deadline)) {
                        log.warn("{}: next retry in {}ms would pass the deadline, giving up after {} attempts: {}",
                                operation, delay.toMillis(), failedAttempt, failure.getMessage());
                        return Mono.<Long>error(failure);
                    }

                    RetryState state = new RetryState(operation, failedAttempt, delay, deadline, failure);
                    observer.accept(state);
                    log.warn("{}: attempt {} failed ({}), retrying in {}ms",
                            operation, failedAttempt, failure.getMessage(), delay.toMillis());

                    return Mono.delay(delay, scheduler);
                })))
                .doOnSuccess(value -> log.debug("{}: succeeded", operation));
    }

    private <T> Mono<T> attempt(String operation, Supplier<Mono<T>> call, RetryPolicy policy) {
        Mono<T> attempt = Mono.defer(call);
        if (!policy.hasAttemptTimeout()) {
            return attempt;
        }

        Duration attemptTimeout = policy.getAttemptTimeout();
        return attempt.timeout(attemptTimeout, Mono.defer(() -> Mono.error(
                new TransientProviderException(operation, null,
                        "Attempt exceeded " + attemptTimeout.toMillis() + "ms",
                        new TimeoutException()))), scheduler);
    }

    private boolean isRetryable(Throwable failure) {
        return failure instanceof MediationException mediation && mediation.isRetryable();
    }
}
