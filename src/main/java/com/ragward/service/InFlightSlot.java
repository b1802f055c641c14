package com.ragward.service;

import com.ragward.model.CacheKey;
import lombok.Getter;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * One in-progress provider call for a cache key, shared by every caller waiting on that key.
 *
 * Waiters receive the outcome in the order they subscribed. Once the last waiter leaves before
 * the outcome is known, the slot is abandoned: it accepts no further joins and its provider call
 * is cancelled.
 */
public class InFlightSlot {

    @Getter
    private final CacheKey key;

    private final Sinks.One<String> outcome = Sinks.one();

    private int waiters;
    private boolean resolved;
    private boolean abandoned;
    private Disposable call;

    InFlightSlot(CacheKey key) {
        this.key = key;
    }

    /**
     * Register a waiter.
     *
     * @return false if the slot was abandoned and must not be joined
     */
    synchronized boolean join() {
        if (abandoned) {
            return false;
        }
        waiters++;
        return true;
    }

    /**
     * Deregister a waiter that lost interest before the outcome arrived.
     *
     * @return true if this was the last waiter and the slot is now abandoned
     */
    synchronized boolean leave() {
        if (resolved || abandoned) {
            return false;
        }
        waiters--;
        if (waiters <= 0) {
            abandoned = true;
            return true;
        }
        return false;
    }

    /**
     * Attach the provider call so it can be cancelled if every waiter leaves.
     */
    void attach(Disposable providerCall) {
        boolean cancelNow;
        synchronized (this) {
            this.call = providerCall;
            cancelNow = abandoned;
        }
        if (cancelNow) {
            providerCall.dispose();
        }
    }

    void cancelCall() {
        Disposable current;
        synchronized (this) {
            current = call;
        }
        if (current != null) {
            current.dispose();
        }
    }

    void complete(String value) {
        markResolved();
        outcome.emitValue(value, Sinks.EmitFailureHandler.FAIL_FAST);
    }

    void fail(Throwable error) {
        markResolved();
        outcome.emitError(error, Sinks.EmitFailureHandler.FAIL_FAST);
    }

    /**
     * Outcome shared by all waiters; replayed to waiters that subscribe after resolution.
     */
    Mono<String> outcome() {
        return outcome.asMono();
    }

    synchronized int getWaiterCount() {
        return waiters;
    }

    synchronized boolean isAbandoned() {
        return abandoned;
    }

    private synchronized void markResolved() {
        resolved = true;
    }
}
