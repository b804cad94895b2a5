package com.flagship.solid_ledger.event;

import com.flagship.solid_ledger.chain.Address;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for contract events.
 *
 * All events share these common properties:
 * - Event ID for deduplication downstream
 * - Emitting contract address (aggregate ID, also the Kafka key)
 * - Block in which the emitting operation ran
 */
public interface LedgerEvent {

    /**
     * Unique identifier for this event instance.
     */
    UUID getEventId();

    /**
     * The contract that emitted this event.
     */
    Address getContract();

    long getBlockNumber();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
