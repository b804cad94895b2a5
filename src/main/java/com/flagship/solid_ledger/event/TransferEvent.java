package com.flagship.solid_ledger.event;

import com.flagship.solid_ledger.chain.Address;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Units moved between accounts. Mints come from the zero address, burns go to it.
 */
@Value
public class TransferEvent implements LedgerEvent {
    UUID eventId;
    Address contract;
    long blockNumber;
    Address from;
    Address to;
    BigInteger amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "Transfer";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransferEvent of(Address contract, long blockNumber, Address from, Address to, BigInteger amount) {
        return new TransferEvent(UUID.randomUUID(), contract, blockNumber, from, to, amount, Instant.now());
    }
}
