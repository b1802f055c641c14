package com.ragward.service;

import com.ragward.model.CacheKey;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Table of in-flight provider calls, at most one slot per cache key.
 *
 * Claim-or-join is a single atomic map operation, so two callers can never both believe they
 * claimed the same key.
 */
@Slf4j
public class InFlightTable {

    private final ConcurrentHashMap<CacheKey, InFlightSlot> slots = new ConcurrentHashMap<>();

    /**
     * Join the live slot for a key, or claim a new one.
     */
    public Claim claimOrJoin(CacheKey key) {
        AtomicBoolean owner = new AtomicBoolean(false);

        InFlightSlot slot = slots.compute(key, (k, existing) -> {
            if (existing != null && existing.join()) {
                return existing;
            }
            InFlightSlot fresh = new InFlightSlot(k);
            fresh.join();
            owner.set(true);
            return fresh;
        });

        if (!owner.get()) {
            log.debug("Joined in-flight call: key={}, waiters={}", key, slot.getWaiterCount());
        }
        return new Claim(slot, owner.get());
    }

    /**
     * Remove the slot if it is still the one registered for its key.
     */
    public void release(InFlightSlot slot) {
        slots.remove(slot.getKey(), slot);
    }

    public int size() {
        return slots.size();
    }

    /**
     * Result of claim-or-join.
     *
     * @param slot  the slot for the key
     * @param owner true if the caller created the slot and must issue the provider call
     */
    public record Claim(InFlightSlot slot, boolean owner) {
    }
}
