package com.flagship.solid_ledger.token;

import com.flagship.solid_ledger.chain.Address;
import com.flagship.solid_ledger.chain.Chain;
import com.flagship.solid_ledger.chain.ManualBlockSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class SameBlockGuardTest {

    private final Address alice = Address.derive("alice");
    private final Address bob = Address.derive("bob");

    private ManualBlockSource blocks;
    private Chain chain;
    private SameBlockGuard guard;

    @BeforeEach
    void setUp() {
        blocks = new ManualBlockSource(0);
        chain = new Chain(blocks);
        guard = new SameBlockGuard(chain);
    }

    @Test
    @DisplayName("Second mutation in the same block by the same caller is rejected")
    void testSameBlockRejected() {
        chain.run(() -> guard.check(alice));

        LedgerException e = assertThrows(LedgerException.class, () -> chain.run(() -> guard.check(alice)));

        assertEquals(ErrorCode.SAME_BLOCK_REPLAY, e.getCode());
    }

    @Test
    @DisplayName("The next block accepts the caller again")
    void testNextBlockAccepted() {
        chain.run(() -> guard.check(alice));
        blocks.advance();

        assertDoesNotThrow(() -> chain.run(() -> guard.check(alice)));
        assertEquals(OptionalLong.of(1), guard.lastMutationBlock(alice));
    }

    @Test
    @DisplayName("Several moves inside one execution count as one mutation")
    void testSameExecutionCountsOnce() {
        assertDoesNotThrow(() -> chain.run(() -> {
            guard.check(alice);
            guard.check(alice);
        }));
    }

    @Test
    @DisplayName("An account that never mutated is accepted even at block zero")
    void testNeverMutatedAtBlockZero() {
        assertEquals(OptionalLong.empty(), guard.lastMutationBlock(bob));

        assertDoesNotThrow(() -> chain.run(() -> guard.check(bob)));
    }

    @Test
    @DisplayName("Callers are tracked independently")
    void testIndependentCallers() {
        chain.run(() -> guard.check(alice));

        assertDoesNotThrow(() -> chain.run(() -> guard.check(bob)));
    }

    @Test
    @DisplayName("A rolled-back mutation does not count")
    void testRolledBackMutationForgotten() {
        assertThrows(IllegalStateException.class, () -> chain.run(() -> {
            guard.check(alice);
            throw new IllegalStateException("later failure");
        }));

        assertEquals(OptionalLong.empty(), guard.lastMutationBlock(alice));
        assertDoesNotThrow(() -> chain.run(() -> guard.check(alice)));
    }
}
