package com.flagship.solid_ledger.outbox;

import com.flagship.solid_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Background publisher that relays committed contract events to Kafka.
 *
 * This component:
 * 1. Polls the outbox for unpublished events, oldest first
 * 2. Publishes each event to the ledger events topic
 * 3. Marks events as published on success
 * 4. Counts a retry on failure; events past max retries are dead letters
 * 5. Purges published events older than the retention window
 *
 * The contract address is the Kafka key, so events of one contract keep
 * their commit order within a partition.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.retention:PT24H}")
    private Duration retention;

    /**
     * Polls for and publishes unpublished events.
     */
    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize, maxRetries);

            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());

            for (OutboxEvent event : events) {
                if (!publishEvent(event)) {
                    // Later events of the batch wait, keeping commit order
                    break;
                }
            }

        } catch (RuntimeException e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    /**
     * Publishes a single event and waits for the broker acknowledgment.
     *
     * @return true if the event was published
     */
    boolean publishEvent(OutboxEvent event) {
        try {
            CompletableFuture<SendResult<String, String>> future =
                kafkaTemplate.send(ledgerEventsTopic, event.getContract(), event.getPayload());

            SendResult<String, String> result = future.get();

            log.debug("Published event: eventId={}, seq={}, partition={}, offset={}, eventType={}",
                event.getId(),
                event.getSequenceNumber(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset(),
                event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            return true;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "Interrupted while publishing");
            return false;
        } catch (ExecutionException | RuntimeException e) {
            String message = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                event.getId(), event.getEventType(), message);
            recordFailure(event, message);
            return false;
        }
    }

    private void recordFailure(OutboxEvent event, String message) {
        outboxService.markFailed(event.getId(), message);
        outboxMetrics.recordEventPublishFailed(event.getEventType());

        if (event.getRetryCount() + 1 >= maxRetries) {
            log.warn("Event {} has exceeded max retries ({}), moving to dead letter. eventType={}, contract={}",
                event.getId(), maxRetries, event.getEventType(), event.getContract());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }

    /**
     * Removes published events past the retention window.
     */
    @Scheduled(fixedRateString = "${outbox.cleanup.interval-ms:3600000}")
    public void purgePublishedEvents() {
        outboxService.purgePublishedBefore(Instant.now().minus(retention));
    }

    /**
     * Manually triggers publishing (useful for testing).
     */
    public void triggerPublish() {
        publishPendingEvents();
    }

    public long getUnpublishedCount() {
        return outboxService.countUnpublished();
    }
}
