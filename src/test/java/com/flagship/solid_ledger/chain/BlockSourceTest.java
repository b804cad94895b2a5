package com.flagship.solid_ledger.chain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class BlockSourceTest {

    private static final Instant GENESIS = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    @DisplayName("Clock block source counts whole intervals since genesis")
    void testClockBlockSource() {
        Clock clock = Clock.fixed(GENESIS.plusSeconds(125), ZoneOffset.UTC);

        ClockBlockSource source = new ClockBlockSource(clock, GENESIS, Duration.ofSeconds(12));

        assertEquals(10, source.currentBlock());
    }

    @Test
    @DisplayName("Clock before genesis yields block zero")
    void testBeforeGenesis() {
        Clock clock = Clock.fixed(GENESIS.minusSeconds(60), ZoneOffset.UTC);

        assertEquals(0, new ClockBlockSource(clock, GENESIS, Duration.ofSeconds(12)).currentBlock());
    }

    @Test
    @DisplayName("Manual block source only moves forward")
    void testManualBlockSource() {
        ManualBlockSource source = new ManualBlockSource(5);

        assertEquals(6, source.advance());
        assertEquals(9, source.advance(3));
        source.advanceTo(20);
        assertEquals(20, source.currentBlock());
        assertThrows(IllegalArgumentException.class, () -> source.advanceTo(19));
        assertThrows(IllegalArgumentException.class, () -> source.advance(-1));
    }

    @Test
    @DisplayName("Non-positive block interval is rejected")
    void testInvalidInterval() {
        assertThrows(IllegalArgumentException.class,
            () -> new ClockBlockSource(Clock.systemUTC(), GENESIS, Duration.ZERO));
    }
}
