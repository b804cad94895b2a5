package com.flagship.solid_ledger.event;

import com.flagship.solid_ledger.chain.Address;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Allowance set by an owner for a spender.
 */
@Value
public class ApprovalEvent implements LedgerEvent {
    UUID eventId;
    Address contract;
    long blockNumber;
    Address owner;
    Address spender;
    BigInteger amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "Approval";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ApprovalEvent of(Address contract, long blockNumber, Address owner, Address spender, BigInteger amount) {
        return new ApprovalEvent(UUID.randomUUID(), contract, blockNumber, owner, spender, amount, Instant.now());
    }
}
