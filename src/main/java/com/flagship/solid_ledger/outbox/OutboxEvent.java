package com.flagship.solid_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A committed contract event waiting to be relayed to Kafka.
 *
 * Key properties:
 * - Immutable value object; state changes return a new instance
 * - Written only when the emitting operation commits
 * - Tracks publishing status and retry information
 */
@Value
public class OutboxEvent {
    UUID id;                   // event ID of the contract event
    long sequenceNumber;       // commit order, assigned by the store
    String contract;           // emitting contract address, the Kafka key
    String eventType;          // e.g., "Transfer"
    long blockNumber;
    String payload;            // JSON payload
    Instant createdAt;
    Instant publishedAt;       // null if not yet published
    int retryCount;
    String lastError;

    /**
     * Creates a new unpublished outbox event.
     */
    public static OutboxEvent create(UUID id, long sequenceNumber, String contract,
                                     String eventType, long blockNumber, String payload) {
        return new OutboxEvent(
            id,
            sequenceNumber,
            contract,
            eventType,
            blockNumber,
            payload,
            Instant.now(),
            null,  // not published yet
            0,     // no retries yet
            null   // no errors yet
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }

    public OutboxEvent markPublished() {
        return new OutboxEvent(id, sequenceNumber, contract, eventType, blockNumber, payload,
            createdAt, Instant.now(), retryCount, null);
    }

    public OutboxEvent markRetry(String errorMessage) {
        return new OutboxEvent(id, sequenceNumber, contract, eventType, blockNumber, payload,
            createdAt, publishedAt, retryCount + 1, errorMessage);
    }
}
