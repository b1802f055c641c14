package com.ragward.service;

import com.ragward.cache.ResponseCacheStore;
import com.ragward.config.RagwardProperties;
import com.ragward.exception.InputException;
import com.ragward.exception.PermanentProviderException;
import com.ragward.exception.QueryTimeoutException;
import com.ragward.model.CacheEntry;
import com.ragward.model.CacheKey;
import com.ragward.model.ModelParameters;
import com.ragward.model.QueryMode;
import com.ragward.model.QueryRequest;
import com.ragward.model.QueryResult;
import com.ragward.resilience.RetryController;
import com.ragward.resilience.RetryPolicy;
import com.ragward.resilience.TimeoutSupervisor;
import com.ragward.service.fingerprint.RequestFingerprinter;
import com.ragward.service.selection.ModeSelector;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Orchestrates one request/response cycle.
 *
 * Flow:
 * 1. Reject empty text
 * 2. Select mode, compute cache key
 * 3. Cache hit - return without any provider call
 * 4. Cache miss - claim the key's in-flight slot, or join it if another caller holds it
 * 5. Claimer runs Timeout(Retry(provider)) and shares the outcome with every waiter
 * 6. Success is cached before the slot is released; failures are never cached
 *
 * A waiter whose own deadline fires stops waiting without cancelling the shared call. The call is
 * cancelled when the claimer's deadline fires or when every waiter has abandoned it.
 */
@Slf4j
public class QueryDispatcher {

    private final ModeSelector modeSelector;
    private final RequestFingerprinter fingerprinter;
    private final ResponseCacheStore cacheStore;
    private final InFlightTable inFlight;
    private final QueryExecutor executor;
    private final RetryController retryController;
    private final TimeoutSupervisor timeoutSupervisor;
    private final RetryPolicy retryPolicy;
    private final RagwardProperties properties;
    private final Clock clock;

    public QueryDispatcher(
            ModeSelector modeSelector,
            RequestFingerprinter fingerprinter,
            ResponseCacheStore cacheStore,
            InFlightTable inFlight,
            QueryExecutor executor,
            RetryController retryController,
            TimeoutSupervisor timeoutSupervisor,
            RagwardProperties properties,
            Clock clock) {
        this.modeSelector = modeSelector;
        this.fingerprinter = fingerprinter;
        this.cacheStore = cacheStore;
        this.inFlight = inFlight;
        this.executor = executor;
        this.retryController = retryController;
        this.timeoutSupervisor = timeoutSupervisor;
        this.retryPolicy = RetryPolicy.from(properties.getRetry());
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Dispatch one question.
     *
     * @param request question with optional pinned mode and deadline
     * @return response with cache provenance, or a {@link com.ragward.exception.MediationException}
     */
    public Mono<QueryResult> dispatch(QueryRequest request) {
        return Mono.defer(() -> {
            if (request == null || request.getRawText() == null || request.getRawText().isBlank()) {
                return Mono.error(new InputException("Question text must not be empty"));
            }

            String text = request.getRawText().strip();
            QueryMode mode = modeSelector.select(text, request.getMode());

            if (mode == QueryMode.BYPASS
                    && properties.getBypass().getStrategy() == RagwardProperties.BypassStrategy.CANNED) {
                log.info("BYPASS query answered with canned reply");
                return Mono.just(QueryResult.builder()
                        .response(properties.getBypass().getReply())
                        .mode(mode)
                        .build());
            }

            ModelParameters parameters = request.getParameters() != null
                    ? request.getParameters() : ModelParameters.defaults();
            CacheKey key = fingerprinter.fingerprint(mode, text, request.getCorpusVersion(), parameters);
            Duration maxWait = properties.getTimeout().resolve(request.getMaxWait());

            Optional<CacheEntry> cached = cacheStore.get(key);
            if (cached.isPresent()) {
                log.info("Serving cached response: mode={}, key={}", mode.wireName(), key);
                return Mono.just(hit(cached.get().getValue(), mode, key));
            }

            InFlightTable.Claim claim = inFlight.claimOrJoin(key);
            if (!claim.owner()) {
                return awaitShared(claim.slot(), maxWait)
                        .map(value -> QueryResult.builder()
                                .response(value)
                                .mode(mode)
                                .cacheKey(key)
                                .shared(true)
                                .build());
            }

            // Another claimer may have cached the value between our lookup and our claim.
            Optional<CacheEntry> raced = cacheStore.get(key);
            if (raced.isPresent()) {
                inFlight.release(claim.slot());
                claim.slot().complete(raced.get().getValue());
                return Mono.just(hit(raced.get().getValue(), mode, key));
            }

            log.info("Cache miss - calling provider: mode={}, key={}, maxWait={}ms",
                    mode.wireName(), key, maxWait.toMillis());
            startProviderCall(claim.slot(), text, mode, parameters, maxWait);

            return claim.slot().outcome()
                    .doOnCancel(() -> leave(claim.slot()))
                    .map(value -> QueryResult.builder()
                            .response(value)
                            .mode(mode)
                            .cacheKey(key)
                            .build());
        });
    }

    /**
     * Dispatch many questions with at most {@code batch.max-concurrent-documents} in flight.
     * Each item completes independently; one failure does not cancel the others.
     *
     * @param requests questions in submission order
     * @return one outcome per request, in submission order
     */
    public Flux<BatchOutcome> dispatchAll(List<QueryRequest> requests) {
        int concurrency = Math.max(1, properties.getBatch().getMaxConcurrentDocuments());

        return Flux.range(0, requests.size())
                .flatMapSequential(index -> dispatch(requests.get(index))
                        .map(result -> BatchOutcome.success(index, result))
                        .onErrorResume(error -> Mono.just(BatchOutcome.failure(index, error))),
                        concurrency);
    }

    public int getInFlightCount() {
        return inFlight.size();
    }

    private void startProviderCall(InFlightSlot slot, String text, QueryMode mode,
                                   ModelParameters parameters, Duration maxWait) {
        CacheKey key = slot.getKey();
        Instant deadline = clock.instant().plus(maxWait);
        AtomicReference<Throwable> lastError = new AtomicReference<>();

        Mono<String> call = timeoutSupervisor.runWithTimeout(
                retryController.callWithRetry(
                        "query[" + mode.wireName() + "]",
                        () -> executor.execute(text, mode, parameters)
                                .doOnError(lastError::set),
                        retryPolicy,
                        deadline,
                        state -> lastError.set(state.getLastError())),
                maxWait,
                lastError::get);

        Disposable subscription = call.subscribe(
                value -> onSuccess(slot, value),
                error -> onFailure(slot, error),
                () -> onFailure(slot, new PermanentProviderException(executor.getProviderName(),
                        "Provider returned no response for key " + key)));
        slot.attach(subscription);
    }

    private void onSuccess(InFlightSlot slot, String value) {
        // Cache before releasing the slot so a later caller sees either the slot or the entry.
        cacheStore.put(slot.getKey(), value);
        inFlight.release(slot);
        slot.complete(value);
        log.info("Provider call succeeded: key={}, waiters={}", slot.getKey(), slot.getWaiterCount());
    }

    private void onFailure(InFlightSlot slot, Throwable error) {
        inFlight.release(slot);
        slot.fail(error);
        log.error("Provider call failed: key={}, waiters={}: {}",
                slot.getKey(), slot.getWaiterCount(), error.getMessage());
    }

    private Mono<String> awaitShared(InFlightSlot slot, Duration maxWait) {
        return slot.outcome()
                .doOnCancel(() -> leave(slot))
                .timeout(maxWait, Mono.defer(() -> Mono.error(new QueryTimeoutException(maxWait, null))));
    }

    private void leave(InFlightSlot slot) {
        if (slot.leave()) {
            log.info("All waiters abandoned key={}, cancelling provider call", slot.getKey());
            inFlight.release(slot);
            slot.cancelCall();
        }
    }

    private QueryResult hit(String value, QueryMode mode, CacheKey key) {
        return QueryResult.builder()
                .response(value)
                .mode(mode)
                .cacheKey(key)
                .cacheHit(true)
                .build();
    }
}
