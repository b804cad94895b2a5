package com.flagship.solid_ledger.chain;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Derives block numbers from wall-clock time: one block per interval since genesis.
 */
public class ClockBlockSource implements BlockSource {

    private final Clock clock;
    private final Instant genesis;
    private final long intervalMillis;

    public ClockBlockSource(Clock clock, Instant genesis, Duration blockInterval) {
        if (blockInterval == null || blockInterval.isZero() || blockInterval.isNegative()) {
            throw new IllegalArgumentException("Block interval must be positive");
        }
        this.clock = clock;
        this.genesis = genesis;
        this.intervalMillis = blockInterval.toMillis();
    }

    @Override
    public long currentBlock() {
        long elapsed = Duration.between(genesis, clock.instant()).toMillis();
        return Math.max(0L, elapsed / intervalMillis);
    }
}
