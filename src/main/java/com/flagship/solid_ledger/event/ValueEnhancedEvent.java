package com.flagship.solid_ledger.event;

import com.flagship.solid_ledger.chain.Address;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Currency forwarded to the reserve keeper, raising the solid value of every unit.
 */
@Value
public class ValueEnhancedEvent implements LedgerEvent {
    UUID eventId;
    Address contract;
    long blockNumber;
    Address contributor;
    BigInteger amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ValueEnhanced";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ValueEnhancedEvent of(Address contract, long blockNumber, Address contributor, BigInteger amount) {
        return new ValueEnhancedEvent(UUID.randomUUID(), contract, blockNumber, contributor, amount, Instant.now());
    }
}
