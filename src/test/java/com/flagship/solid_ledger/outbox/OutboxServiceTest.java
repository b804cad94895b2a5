package com.flagship.solid_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.solid_ledger.chain.Address;
import com.flagship.solid_ledger.chain.Chain;
import com.flagship.solid_ledger.chain.CurrencyNetwork;
import com.flagship.solid_ledger.chain.ManualBlockSource;
import com.flagship.solid_ledger.config.JacksonConfig;
import com.flagship.solid_ledger.event.TransferEvent;
import com.flagship.solid_ledger.token.Allocation;
import com.flagship.solid_ledger.token.LedgerException;
import com.flagship.solid_ledger.token.SolidValueToken;
import com.flagship.solid_ledger.token.TokenMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests that the outbox receives exactly the events of committed operations.
 */
class OutboxServiceTest {

    private final Address deployer = Address.derive("deployer");
    private final Address alice = Address.derive("alice");
    private final Address bob = Address.derive("bob");

    private ObjectMapper objectMapper;
    private OutboxStore store;
    private OutboxService outboxService;
    private ManualBlockSource blocks;
    private SolidValueToken token;

    @BeforeEach
    void setUp() {
        objectMapper = new JacksonConfig().objectMapper();
        store = new OutboxStore();
        outboxService = new OutboxService(store, objectMapper);

        blocks = new ManualBlockSource();
        Chain chain = new Chain(blocks);
        chain.registerSink(outboxService);
        CurrencyNetwork network = new CurrencyNetwork(chain);
        network.credit(deployer, BigInteger.valueOf(10_000));

        token = SolidValueToken.deploy(network, deployer, new TokenMetadata("Outbox Token", "OBX", 18),
            List.of(Allocation.to(alice, BigInteger.valueOf(100))), BigInteger.ZERO);
        blocks.advance();
    }

    @Test
    @DisplayName("Committed events are stored in commit order with a JSON payload")
    void testCommittedEventsStored() throws Exception {
        token.transfer(alice, bob, BigInteger.valueOf(40));

        List<OutboxEvent> unpublished = outboxService.findUnpublishedEvents(10, 5);
        assertEquals(2, unpublished.size(), "Deployment mint and the transfer");

        OutboxEvent transfer = unpublished.get(1);
        assertTrue(transfer.getSequenceNumber() > unpublished.get(0).getSequenceNumber());
        assertEquals(TransferEvent.EVENT_TYPE, transfer.getEventType());
        assertEquals(token.getAddress().toString(), transfer.getContract());
        assertEquals(2, transfer.getBlockNumber());
        assertFalse(transfer.isPublished());

        JsonNode payload = objectMapper.readTree(transfer.getPayload());
        assertEquals(alice.toString(), payload.get("from").asText());
        assertEquals(bob.toString(), payload.get("to").asText());
        assertEquals(40, payload.get("amount").asInt());
        assertEquals("Transfer", payload.get("eventType").asText());
    }

    @Test
    @DisplayName("A rejected operation writes nothing to the outbox")
    void testRejectedOperationWritesNothing() {
        long before = outboxService.countUnpublished();

        assertThrows(LedgerException.class, () -> token.transfer(alice, bob, BigInteger.valueOf(1_000)));

        assertEquals(before, outboxService.countUnpublished());
    }

    @Test
    @DisplayName("Published and failed events are tracked; old published events are purged")
    void testPublishingLifecycle() {
        token.transfer(alice, bob, BigInteger.ONE);
        List<OutboxEvent> events = outboxService.findUnpublishedEvents(10, 5);
        OutboxEvent first = events.get(0);
        OutboxEvent second = events.get(1);

        outboxService.markPublished(first.getId());
        outboxService.markFailed(second.getId(), "broker down");

        assertTrue(store.findById(first.getId()).orElseThrow().isPublished());
        OutboxEvent failed = store.findById(second.getId()).orElseThrow();
        assertEquals(1, failed.getRetryCount());
        assertEquals("broker down", failed.getLastError());
        assertEquals(1, outboxService.countUnpublished());

        assertEquals(1, outboxService.purgePublishedBefore(Instant.now().plusSeconds(1)));
        assertTrue(store.findById(first.getId()).isEmpty());
    }

    @Test
    @DisplayName("Events past the retry limit are dead letters and no longer fetched")
    void testDeadLetters() {
        OutboxEvent event = outboxService.findUnpublishedEvents(10, 2).get(0);

        outboxService.markFailed(event.getId(), "first");
        outboxService.markFailed(event.getId(), "second");

        assertTrue(outboxService.findUnpublishedEvents(10, 2).isEmpty());
        assertEquals(1, store.countDeadLettered(2));
    }

    @Test
    @DisplayName("An execution whose events cannot all be serialized stores none and rolls back")
    void testSerializationFailureRollsBack() throws Exception {
        ObjectMapper failing = mock(ObjectMapper.class);
        when(failing.writeValueAsString(any()))
            .thenReturn("{}")
            .thenThrow(new JsonProcessingException("unserializable") { });
        OutboxStore failingStore = new OutboxStore();

        Chain chain = new Chain(new ManualBlockSource());
        chain.registerSink(new OutboxService(failingStore, failing));
        CurrencyNetwork network = new CurrencyNetwork(chain);
        network.credit(deployer, BigInteger.valueOf(10_000));

        // Two mints in one execution: the second payload fails
        assertThrows(IllegalArgumentException.class, () -> SolidValueToken.deploy(network, deployer,
            new TokenMetadata("Broken", "BRK", 18),
            List.of(Allocation.to(alice, BigInteger.valueOf(100)), Allocation.to(bob, BigInteger.valueOf(50))),
            BigInteger.valueOf(500)));

        assertEquals(0, failingStore.countUnpublished());
        assertEquals(BigInteger.valueOf(10_000), network.balanceOf(deployer));
    }
}
