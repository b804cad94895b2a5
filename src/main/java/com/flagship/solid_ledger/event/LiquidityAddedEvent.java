package com.flagship.solid_ledger.event;

import com.flagship.solid_ledger.chain.Address;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Currency deposited into the liquidity lock together with its unlock block.
 */
@Value
public class LiquidityAddedEvent implements LedgerEvent {
    UUID eventId;
    Address contract;
    long blockNumber;
    Address provider;
    BigInteger amount;
    long unlockBlock;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LiquidityAdded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LiquidityAddedEvent of(Address contract, long blockNumber, Address provider,
                                         BigInteger amount, long unlockBlock) {
        return new LiquidityAddedEvent(UUID.randomUUID(), contract, blockNumber,
            provider, amount, unlockBlock, Instant.now());
    }
}
