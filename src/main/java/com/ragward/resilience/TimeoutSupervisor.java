package com.ragward.resilience;

import com.ragward.exception.QueryTimeoutException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounds the total wall-clock time of one logical call.
 *
 * When the deadline fires, the upstream subscription is cancelled, which aborts the in-flight
 * provider request (WebClient closes the exchange, futures are cancelled) and releases its
 * resources. Whichever of result and deadline arrives first is the only signal delivered.
 */
@Slf4j
public class TimeoutSupervisor {

    private final Scheduler scheduler;

    public TimeoutSupervisor(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public <T> Mono<T> runWithTimeout(Mono<T> call, Duration maxWait) {
        return runWithTimeout(call, maxWait, () -> null);
    }

    /**
     * Race the call against {@code maxWait}.
     *
     * @param call      operation to supervise
     * @param maxWait   user-visible deadline
     * @param lastError last underlying error observed so far, attached to the timeout
     * @return the call's outcome, or {@link QueryTimeoutException} once the deadline passes
     */
    public <T> Mono<T> runWithTimeout(Mono<T> call, Duration maxWait, Supplier<Throwable> lastError) {
        return call.timeout(maxWait, Mono.defer(() -> {
            Throwable cause = lastError.get();
            log.warn("Deadline of {}ms exceeded, cancelled in-flight call (last error: {})",
                    maxWait.toMillis(), cause != null ? cause.getMessage() : "none");
            return Mono.error(new QueryTimeoutException(maxWait, cause));
        }), scheduler);
    }
}
