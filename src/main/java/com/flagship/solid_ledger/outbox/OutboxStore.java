package com.flagship.solid_ledger.outbox;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * In-memory outbox table, ordered by sequence number.
 *
 * Provides methods for:
 * - Appending events (done when an execution commits)
 * - Finding unpublished events (done by the background publisher)
 * - Marking events as published or failed
 * - Retention cleanup and monitoring queries
 */
@Component
public class OutboxStore {

    private final ConcurrentSkipListMap<Long, OutboxEvent> events = new ConcurrentSkipListMap<>();
    private final ConcurrentHashMap<UUID, Long> sequenceById = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public long nextSequence() {
        return sequence.incrementAndGet();
    }

    public OutboxEvent save(OutboxEvent event) {
        events.put(event.getSequenceNumber(), event);
        sequenceById.put(event.getId(), event.getSequenceNumber());
        return event;
    }

    public Optional<OutboxEvent> findById(UUID id) {
        Long seq = sequenceById.get(id);
        return seq == null ? Optional.empty() : Optional.ofNullable(events.get(seq));
    }

    /**
     * Applies a change to a stored event, if it still exists.
     */
    public Optional<OutboxEvent> update(UUID id, UnaryOperator<OutboxEvent> change) {
        Long seq = sequenceById.get(id);
        if (seq == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(events.computeIfPresent(seq, (k, existing) -> change.apply(existing)));
    }

    /**
     * Unpublished events below the retry threshold, oldest first.
     */
    public List<OutboxEvent> findUnpublished(int limit, int maxRetries) {
        return events.values().stream()
            .filter(e -> !e.isPublished() && e.getRetryCount() < maxRetries)
            .limit(limit)
            .toList();
    }

    public List<OutboxEvent> findByContract(String contract) {
        return events.values().stream()
            .filter(e -> e.getContract().equals(contract))
            .toList();
    }

    public long countUnpublished() {
        return events.values().stream().filter(e -> !e.isPublished()).count();
    }

    public long countDeadLettered(int maxRetries) {
        return events.values().stream().filter(e -> e.isDeadLettered(maxRetries)).count();
    }

    public Optional<Instant> findOldestUnpublishedCreatedAt() {
        return events.values().stream()
            .filter(e -> !e.isPublished())
            .map(OutboxEvent::getCreatedAt)
            .findFirst();
    }

    /**
     * Deletes published events older than the given timestamp.
     *
     * @return number of deleted events
     */
    public int deletePublishedBefore(Instant before) {
        int deleted = 0;
        for (OutboxEvent event : events.values()) {
            if (event.isPublished() && event.getPublishedAt().isBefore(before)
                    && events.remove(event.getSequenceNumber(), event)) {
                sequenceById.remove(event.getId());
                deleted++;
            }
        }
        return deleted;
    }
}
