package com.flagship.solid_ledger.observability;

import com.flagship.solid_ledger.chain.Address;
import com.flagship.solid_ledger.chain.Chain;
import com.flagship.solid_ledger.chain.CurrencyNetwork;
import com.flagship.solid_ledger.chain.ManualBlockSource;
import com.flagship.solid_ledger.token.Allocation;
import com.flagship.solid_ledger.token.ErrorCode;
import com.flagship.solid_ledger.token.LedgerException;
import com.flagship.solid_ledger.token.SolidValueToken;
import com.flagship.solid_ledger.token.TokenMetadata;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenMetricsTest {

    private final Address deployer = Address.derive("deployer");
    private final Address alice = Address.derive("alice");

    private SimpleMeterRegistry registry;
    private SolidValueToken token;
    private TokenMetrics metrics;

    @BeforeEach
    void setUp() {
        ManualBlockSource blocks = new ManualBlockSource();
        CurrencyNetwork network = new CurrencyNetwork(new Chain(blocks));
        network.credit(deployer, BigInteger.valueOf(10_000));
        token = SolidValueToken.deploy(network, deployer, new TokenMetadata("Metered", "MTR", 18),
            List.of(Allocation.toPool(BigInteger.valueOf(500)), Allocation.to(alice, BigInteger.valueOf(100))),
            BigInteger.valueOf(1_000));
        blocks.advance();

        registry = new SimpleMeterRegistry();
        metrics = new TokenMetrics(registry, token);
    }

    @Test
    @DisplayName("Successful operations are counted and timed")
    void testSuccess() {
        Boolean result = metrics.time("transfer", () -> token.transfer(alice, deployer, BigInteger.TEN));

        assertTrue(result);
        assertEquals(1.0, registry.get("token.operations")
            .tag("operation", "transfer").tag("outcome", "success").counter().count());
        assertEquals(1, registry.get("token.operation.duration").tag("operation", "transfer").timer().count());
    }

    @Test
    @DisplayName("Rejections are counted under their error code and rethrown")
    void testRejection() {
        LedgerException e = assertThrows(LedgerException.class,
            () -> metrics.time("transfer", () -> token.transfer(alice, deployer, BigInteger.valueOf(101))));

        assertEquals(ErrorCode.INSUFFICIENT_BALANCE, e.getCode());
        assertEquals(1.0, registry.get("token.operations")
            .tag("operation", "transfer").tag("outcome", "INSUFFICIENT_BALANCE").counter().count());
        assertEquals(1, registry.get("token.operation.duration").tag("operation", "transfer").timer().count());
    }

    @Test
    @DisplayName("Gauges report the last refreshed values")
    void testGauges() {
        assertEquals(0.0, registry.get("token.supply").tag("symbol", "MTR").gauge().value());

        metrics.refreshGauges();

        assertEquals(600.0, registry.get("token.supply").tag("symbol", "MTR").gauge().value());
        assertEquals(0.0, registry.get("token.reserve").gauge().value());
        assertEquals(1_000.0, registry.get("token.pool.currency").gauge().value());
        assertEquals(500.0, registry.get("token.pool.units").gauge().value());
    }
}
