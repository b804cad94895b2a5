package com.flagship.solid_ledger.event;

import com.flagship.solid_ledger.chain.Address;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Trade against the contract's own pool. A buy has currencyIn and unitsOut set,
 * a sell has unitsIn and currencyOut set; the other legs are zero.
 */
@Value
public class SwapEvent implements LedgerEvent {
    UUID eventId;
    Address contract;
    long blockNumber;
    Address sender;
    BigInteger currencyIn;
    BigInteger unitsIn;
    BigInteger currencyOut;
    BigInteger unitsOut;
    Instant occurredAt;

    public static final String EVENT_TYPE = "Swap";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SwapEvent of(Address contract, long blockNumber, Address sender,
                               BigInteger currencyIn, BigInteger unitsIn,
                               BigInteger currencyOut, BigInteger unitsOut) {
        return new SwapEvent(UUID.randomUUID(), contract, blockNumber, sender,
            currencyIn, unitsIn, currencyOut, unitsOut, Instant.now());
    }
}
