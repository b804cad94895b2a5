package com.flagship.solid_ledger.event;

import com.flagship.solid_ledger.chain.Address;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Locked currency withdrawn after the unlock block.
 */
@Value
public class LiquidityRemovedEvent implements LedgerEvent {
    UUID eventId;
    Address contract;
    long blockNumber;
    Address recipient;
    BigInteger amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LiquidityRemoved";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LiquidityRemovedEvent of(Address contract, long blockNumber, Address recipient, BigInteger amount) {
        return new LiquidityRemovedEvent(UUID.randomUUID(), contract, blockNumber, recipient, amount, Instant.now());
    }
}
