package com.flagship.solid_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.solid_ledger.event.EventSink;
import com.flagship.solid_ledger.event.LedgerEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes committed contract events to the outbox.
 *
 * Registered as an {@link EventSink} on the chain, so it only ever sees events
 * of executions that committed:
 *
 * "If the operation commits, the event is guaranteed to be written."
 *
 * Events are NOT published directly to Kafka here. That's done by the
 * {@link OutboxPublisher}, which runs as a background process.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService implements EventSink {

    private final OutboxStore store;
    private final ObjectMapper objectMapper;

    @Override
    public void accept(LedgerEvent event) {
        saveEvent(event);
    }

    /**
     * Serializes every event of an execution before storing any of them, so a
     * serialization failure leaves no entry behind.
     */
    @Override
    public void acceptAll(List<LedgerEvent> events) {
        List<String> payloads = events.stream().map(this::serializePayload).toList();
        for (int i = 0; i < events.size(); i++) {
            append(events.get(i), payloads.get(i));
        }
    }

    /**
     * Serializes an event and appends it to the outbox.
     *
     * @return the stored outbox entry
     */
    public OutboxEvent saveEvent(LedgerEvent event) {
        return append(event, serializePayload(event));
    }

    private OutboxEvent append(LedgerEvent event, String jsonPayload) {
        OutboxEvent saved = store.save(OutboxEvent.create(
            event.getEventId(),
            store.nextSequence(),
            event.getContract().toString(),
            event.getEventType(),
            event.getBlockNumber(),
            jsonPayload));

        log.debug("Saved outbox event: seq={}, type={}, contract={}",
            saved.getSequenceNumber(), saved.getEventType(), saved.getContract());
        return saved;
    }

    public List<OutboxEvent> findUnpublishedEvents(int limit, int maxRetries) {
        return store.findUnpublished(limit, maxRetries);
    }

    public void markPublished(UUID eventId) {
        store.update(eventId, OutboxEvent::markPublished)
            .ifPresent(e -> log.debug("Marked event {} as published", eventId));
    }

    public void markFailed(UUID eventId, String errorMessage) {
        store.update(eventId, e -> e.markRetry(errorMessage))
            .ifPresent(e -> log.warn("Marked event {} as failed (retry #{}): {}",
                eventId, e.getRetryCount(), errorMessage));
    }

    /**
     * Gets events emitted by one contract (for debugging/auditing).
     */
    public List<OutboxEvent> getEventsForContract(String contract) {
        return store.findByContract(contract);
    }

    public long countUnpublished() {
        return store.countUnpublished();
    }

    /**
     * Removes published entries older than the retention window.
     *
     * @return number of purged entries
     */
    public int purgePublishedBefore(Instant cutoff) {
        int purged = store.deletePublishedBefore(cutoff);
        if (purged > 0) {
            log.info("Purged {} published outbox events older than {}", purged, cutoff);
        }
        return purged;
    }

    private String serializePayload(LedgerEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload: " + event.getEventType(), e);
        }
    }
}
