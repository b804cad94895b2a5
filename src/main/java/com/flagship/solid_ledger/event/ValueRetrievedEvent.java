package com.flagship.solid_ledger.event;

import com.flagship.solid_ledger.chain.Address;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Units burned in exchange for their share of the reserve.
 */
@Value
public class ValueRetrievedEvent implements LedgerEvent {
    UUID eventId;
    Address contract;
    long blockNumber;
    Address retriever;
    BigInteger unitsBurned;
    BigInteger payout;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ValueRetrieved";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ValueRetrievedEvent of(Address contract, long blockNumber, Address retriever, BigInteger unitsBurned, BigInteger payout) {
        return new ValueRetrievedEvent(UUID.randomUUID(), contract, blockNumber, retriever, unitsBurned, payout, Instant.now());
    }
}
