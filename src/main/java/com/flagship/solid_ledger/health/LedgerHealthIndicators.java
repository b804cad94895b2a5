package com.flagship.solid_ledger.health;

import com.flagship.solid_ledger.outbox.OutboxStore;
import com.flagship.solid_ledger.token.SolidValueToken;
import com.flagship.solid_ledger.token.SupplySnapshot;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the ledger.
 */
public class LedgerHealthIndicators {

    /**
     * Down if the total supply ever differs from the sum of all balances.
     */
    @Component("conservationHealth")
    public static class ConservationHealthIndicator implements HealthIndicator {

        private final SolidValueToken token;

        public ConservationHealthIndicator(SolidValueToken token) {
            this.token = token;
        }

        @Override
        public Health health() {
            SupplySnapshot snapshot = token.supplySnapshot();
            Health.Builder builder = snapshot.isConserved() ? Health.up() : Health.down();
            return builder
                    .withDetail("totalSupply", snapshot.getTotalSupply().toString())
                    .withDetail("sumOfBalances", snapshot.getSumOfBalances().toString())
                    .withDetail("reserve", snapshot.getReserve().toString())
                    .build();
        }
    }

    /**
     * Unhealthy if too many events are waiting to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxStore outboxStore;

        public OutboxHealthIndicator(OutboxStore outboxStore) {
            this.outboxStore = outboxStore;
        }

        @Override
        public Health health() {
            long backlogSize = outboxStore.countUnpublished();

            Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                    ? Health.up()
                    : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                    ? Health.status("WARNING")
                    : Health.down();

            return builder
                    .withDetail("backlogSize", backlogSize)
                    .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                    .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                    .build();
        }
    }
}
