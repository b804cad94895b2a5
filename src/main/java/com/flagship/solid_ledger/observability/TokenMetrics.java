package com.flagship.solid_ledger.observability;

import com.flagship.solid_ledger.token.LedgerException;
import com.flagship.solid_ledger.token.Reserves;
import com.flagship.solid_ledger.token.SolidValueToken;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Centralized metrics for token operations.
 *
 * Metrics exposed:
 * - token.operations: Counter tagged with operation and outcome (success or error code)
 * - token.operation.duration: Timer per operation
 * - token.supply, token.reserve, token.pool.currency, token.pool.units: Gauges
 *
 * Gauges read cached values refreshed by {@link MetricsScheduler}.
 */
@Component
public class TokenMetrics {

    private final MeterRegistry registry;
    private final SolidValueToken token;

    private final AtomicReference<BigInteger> supply = new AtomicReference<>(BigInteger.ZERO);
    private final AtomicReference<BigInteger> reserve = new AtomicReference<>(BigInteger.ZERO);
    private final AtomicReference<BigInteger> poolCurrency = new AtomicReference<>(BigInteger.ZERO);
    private final AtomicReference<BigInteger> poolUnits = new AtomicReference<>(BigInteger.ZERO);

    public TokenMetrics(MeterRegistry registry, SolidValueToken token) {
        this.registry = registry;
        this.token = token;

        registerGauge("token.supply", "Total units in circulation", supply);
        registerGauge("token.reserve", "Currency held by the reserve keeper", reserve);
        registerGauge("token.pool.currency", "Currency side of the swap pool", poolCurrency);
        registerGauge("token.pool.units", "Unit side of the swap pool", poolUnits);
    }

    private void registerGauge(String name, String description, AtomicReference<BigInteger> value) {
        Gauge.builder(name, value, v -> v.get().doubleValue())
                .description(description)
                .tag("symbol", token.symbol())
                .register(registry);
    }

    // ==================== Counter Methods ====================

    public void recordSuccess(String operation) {
        registry.counter("token.operations",
                "operation", operation,
                "outcome", "success"
        ).increment();
    }

    /**
     * Records a rejected operation, tagged with its error code.
     */
    public void recordRejection(String operation, String errorCode) {
        registry.counter("token.operations",
                "operation", operation,
                "outcome", sanitizeTag(errorCode)
        ).increment();
    }

    // ==================== Timer Methods ====================

    /**
     * Times an operation and counts its outcome. Rejections are counted under
     * their error code and rethrown.
     */
    public <T> T time(String operation, Supplier<T> body) {
        Timer.Sample sample = Timer.start(registry);
        try {
            T result = body.get();
            recordSuccess(operation);
            return result;
        } catch (LedgerException e) {
            recordRejection(operation, e.getCode().name());
            throw e;
        } finally {
            sample.stop(registry.timer("token.operation.duration", "operation", operation));
        }
    }

    // ==================== Gauge Methods ====================

    public void refreshGauges() {
        supply.set(token.totalSupply());
        reserve.set(token.solidValue());
        Reserves reserves = token.getReserves();
        poolCurrency.set(reserves.getCurrency());
        poolUnits.set(reserves.getUnits());
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
