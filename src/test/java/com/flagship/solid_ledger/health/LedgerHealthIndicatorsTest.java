package com.flagship.solid_ledger.health;

import com.flagship.solid_ledger.outbox.OutboxEvent;
import com.flagship.solid_ledger.outbox.OutboxStore;
import com.flagship.solid_ledger.token.SolidValueToken;
import com.flagship.solid_ledger.token.SupplySnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.math.BigInteger;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerHealthIndicatorsTest {

    @Mock
    private SolidValueToken token;

    @Test
    @DisplayName("Conservation is up while supply equals the sum of balances")
    void testConserved() {
        when(token.supplySnapshot()).thenReturn(
            new SupplySnapshot(BigInteger.valueOf(600), BigInteger.valueOf(600), BigInteger.TEN));

        Health health = new LedgerHealthIndicators.ConservationHealthIndicator(token).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("600", health.getDetails().get("totalSupply"));
    }

    @Test
    @DisplayName("Conservation is down when supply and balances diverge")
    void testDiverged() {
        when(token.supplySnapshot()).thenReturn(
            new SupplySnapshot(BigInteger.valueOf(600), BigInteger.valueOf(599), BigInteger.ZERO));

        Health health = new LedgerHealthIndicators.ConservationHealthIndicator(token).health();

        assertEquals(Status.DOWN, health.getStatus());
    }

    @Test
    @DisplayName("Outbox health reports the backlog")
    void testOutboxBacklog() {
        OutboxStore store = new OutboxStore();
        for (int i = 0; i < 3; i++) {
            store.save(OutboxEvent.create(UUID.randomUUID(), store.nextSequence(), "0xaa", "Transfer", 1, "{}"));
        }

        Health health = new LedgerHealthIndicators.OutboxHealthIndicator(store).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(3L, health.getDetails().get("backlogSize"));
    }
}
