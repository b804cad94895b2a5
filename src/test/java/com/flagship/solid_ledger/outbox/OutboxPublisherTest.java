package com.flagship.solid_ledger.outbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.solid_ledger.observability.OutboxMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for relaying outbox entries to Kafka:
 * - Events are published keyed by contract and marked as published
 * - Failed publishes increment the retry count and stop the batch
 * - Events past max retries are no longer attempted
 */
@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    private static final String TOPIC = "ledger-events";
    private static final String CONTRACT = "0x00000000000000000000000000000000000000aa";

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private OutboxStore store;
    private SimpleMeterRegistry meterRegistry;
    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        store = new OutboxStore();
        OutboxService outboxService = new OutboxService(store, new ObjectMapper());
        meterRegistry = new SimpleMeterRegistry();
        OutboxMetrics outboxMetrics = new OutboxMetrics(store, meterRegistry);

        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "ledgerEventsTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 3);
    }

    private OutboxEvent append(String payload) {
        return store.save(OutboxEvent.create(UUID.randomUUID(), store.nextSequence(), CONTRACT,
            "Transfer", 1, payload));
    }

    private CompletableFuture<SendResult<String, String>> acked(String payload) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 0, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(
            new SendResult<>(new ProducerRecord<>(TOPIC, CONTRACT, payload), metadata));
    }

    @Test
    @DisplayName("Unpublished events are sent keyed by contract and marked as published")
    void testPublishes() {
        OutboxEvent first = append("{\"n\":1}");
        OutboxEvent second = append("{\"n\":2}");
        when(kafkaTemplate.send(TOPIC, CONTRACT, "{\"n\":1}")).thenReturn(acked("{\"n\":1}"));
        when(kafkaTemplate.send(TOPIC, CONTRACT, "{\"n\":2}")).thenReturn(acked("{\"n\":2}"));

        publisher.triggerPublish();

        assertTrue(store.findById(first.getId()).orElseThrow().isPublished());
        assertTrue(store.findById(second.getId()).orElseThrow().isPublished());
        assertEquals(0, publisher.getUnpublishedCount());
        assertEquals(2.0, meterRegistry.get("outbox.events.published").tag("status", "success").counter().count());
    }

    @Test
    @DisplayName("A failed send counts a retry and holds back later events")
    void testFailureStopsBatch() {
        OutboxEvent first = append("{\"n\":1}");
        OutboxEvent second = append("{\"n\":2}");
        when(kafkaTemplate.send(TOPIC, CONTRACT, "{\"n\":1}"))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unavailable")));

        publisher.triggerPublish();

        OutboxEvent failed = store.findById(first.getId()).orElseThrow();
        assertFalse(failed.isPublished());
        assertEquals(1, failed.getRetryCount());
        assertEquals("broker unavailable", failed.getLastError());
        assertFalse(store.findById(second.getId()).orElseThrow().isPublished());
        verify(kafkaTemplate, never()).send(eq(TOPIC), eq(CONTRACT), eq("{\"n\":2}"));
    }

    @Test
    @DisplayName("An event that exhausted its retries is dead-lettered and skipped")
    void testDeadLetter() {
        OutboxEvent stuck = append("{\"n\":1}");
        when(kafkaTemplate.send(TOPIC, CONTRACT, "{\"n\":1}"))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unavailable")));

        publisher.triggerPublish();
        publisher.triggerPublish();
        publisher.triggerPublish();
        publisher.triggerPublish();

        assertEquals(3, store.findById(stuck.getId()).orElseThrow().getRetryCount());
        verify(kafkaTemplate, times(3)).send(anyString(), anyString(), anyString());
        assertEquals(1.0, meterRegistry.get("outbox.events.dead_lettered").counter().count());
    }
}
