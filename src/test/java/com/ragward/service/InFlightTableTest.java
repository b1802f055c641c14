package com.ragward.service;

import com.ragward.model.CacheKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InFlightTable and InFlightSlot.
 */
class InFlightTableTest {

    private static final CacheKey KEY = CacheKey.of("d".repeat(64));

    private InFlightTable table;

    @BeforeEach
    void setUp() {
        table = new InFlightTable();
    }

    @Test
    void testFirstClaimOwnsLaterClaimsJoin() {
        InFlightTable.Claim first = table.claimOrJoin(KEY);
        InFlightTable.Claim second = table.claimOrJoin(KEY);

        assertTrue(first.owner());
        assertFalse(second.owner());
        assertSame(first.slot(), second.slot());
        assertEquals(2, first.slot().getWaiterCount());
        assertEquals(1, table.size());
    }

    @Test
    void testOutcomeReplayedToLateSubscribers() {
        InFlightSlot slot = table.claimOrJoin(KEY).slot();
        slot.complete("answer");

        StepVerifier.create(slot.outcome())
                .expectNext("answer")
                .verifyComplete();
    }

    @Test
    void testAbandonedSlotIsNotJoined() {
        InFlightSlot abandoned = table.claimOrJoin(KEY).slot();
        assertTrue(abandoned.leave());
        assertTrue(abandoned.isAbandoned());

        InFlightTable.Claim next = table.claimOrJoin(KEY);

        assertTrue(next.owner());
        assertNotSame(abandoned, next.slot());
    }

    @Test
    void testLeaveAfterResolutionIsIgnored() {
        InFlightSlot slot = table.claimOrJoin(KEY).slot();
        slot.complete("answer");

        assertFalse(slot.leave());
        assertFalse(slot.isAbandoned());
    }

    @Test
    void testReleaseOnlyRemovesSameSlot() {
        InFlightSlot stale = table.claimOrJoin(KEY).slot();
        stale.leave();
        InFlightSlot current = table.claimOrJoin(KEY).slot();

        table.release(stale);
        assertEquals(1, table.size());

        table.release(current);
        assertEquals(0, table.size());
    }
}
