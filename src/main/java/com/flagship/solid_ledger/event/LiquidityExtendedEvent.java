package com.flagship.solid_ledger.event;

import com.flagship.solid_ledger.chain.Address;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class LiquidityExtendedEvent implements LedgerEvent {
    UUID eventId;
    Address contract;
    long blockNumber;
    long previousUnlockBlock;
    long newUnlockBlock;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LiquidityExtended";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LiquidityExtendedEvent of(Address contract, long blockNumber,
                                            long previousUnlockBlock, long newUnlockBlock) {
        return new LiquidityExtendedEvent(UUID.randomUUID(), contract, blockNumber,
            previousUnlockBlock, newUnlockBlock, Instant.now());
    }
}
