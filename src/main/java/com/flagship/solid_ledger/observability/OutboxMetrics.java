package com.flagship.solid_ledger.observability;

import com.flagship.solid_ledger.outbox.OutboxStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the event outbox:
 * - Backlog size: events waiting to be published
 * - Oldest event age: how long the oldest unpublished event has waited
 * - Dead letters: events that exceeded the retry limit
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxStore outboxStore;
    private final MeterRegistry meterRegistry;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    // Cached values updated periodically
    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong deadLetterCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("outbox.backlog.size", backlogSize, AtomicLong::get)
                .description("Number of unpublished events in the outbox")
                .tag("status", "pending")
                .register(meterRegistry);

        Gauge.builder("outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished event in seconds")
                .register(meterRegistry);

        Gauge.builder("outbox.events.failed", deadLetterCount, AtomicLong::get)
                .description("Number of events that exceeded max retry attempts")
                .tag("status", "failed")
                .register(meterRegistry);

        log.info("Outbox metrics registered with Micrometer");
    }

    /**
     * Refreshes the cached metric values. Called periodically by the scheduler.
     */
    public void refreshMetrics() {
        long unpublished = outboxStore.countUnpublished();
        backlogSize.set(unpublished);

        outboxStore.findOldestUnpublishedCreatedAt()
                .ifPresentOrElse(
                        oldest -> oldestEventAgeSeconds.set(
                                Math.max(0, Duration.between(oldest, Instant.now()).getSeconds())),
                        () -> oldestEventAgeSeconds.set(0)
                );

        long deadLettered = outboxStore.countDeadLettered(maxRetries);
        deadLetterCount.set(deadLettered);

        log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s, deadLettered={}",
                unpublished, oldestEventAgeSeconds.get(), deadLettered);
    }

    public long getBacklogSize() {
        return backlogSize.get();
    }

    public long getDeadLetterCount() {
        return deadLetterCount.get();
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.events.published",
                "event_type", eventType,
                "status", "success"
        ).increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.events.published",
                "event_type", eventType,
                "status", "failure"
        ).increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered",
                "event_type", eventType
        ).increment();
    }
}
