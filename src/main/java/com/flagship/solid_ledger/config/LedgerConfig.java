package com.flagship.solid_ledger.config;

import com.flagship.solid_ledger.chain.Address;
import com.flagship.solid_ledger.chain.BlockSource;
import com.flagship.solid_ledger.chain.Chain;
import com.flagship.solid_ledger.chain.ClockBlockSource;
import com.flagship.solid_ledger.chain.CurrencyNetwork;
import com.flagship.solid_ledger.liquidity.LiquidityLock;
import com.flagship.solid_ledger.outbox.OutboxService;
import com.flagship.solid_ledger.token.Allocation;
import com.flagship.solid_ledger.token.SolidValueToken;
import com.flagship.solid_ledger.token.TokenMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wires the chain, the backing currency and the deployed contracts.
 *
 * Bootstrap amounts are configured as comma-separated {@code key=amount} pairs.
 * In the allocation list the key {@code pool} stands for the token's own address.
 */
@Configuration
@Slf4j
public class LedgerConfig {

    static final String POOL_KEY = "pool";

    @Bean
    @ConditionalOnMissingBean(BlockSource.class)
    public BlockSource blockSource(
            @Value("${ledger.chain.genesis:2024-01-01T00:00:00Z}") String genesisInstant,
            @Value("${ledger.chain.block-interval:PT12S}") String interval) {
        Instant genesis = Instant.parse(genesisInstant);
        Duration blockInterval = Duration.parse(interval);
        log.info("Block source: genesis={}, interval={}", genesis, blockInterval);
        return new ClockBlockSource(Clock.systemUTC(), genesis, blockInterval);
    }

    @Bean
    public Chain chain(BlockSource blockSource, OutboxService outboxService) {
        Chain chain = new Chain(blockSource);
        chain.registerSink(outboxService);
        return chain;
    }

    @Bean
    public CurrencyNetwork currencyNetwork(Chain chain,
                                           @Value("${ledger.currency.genesis-balances:}") String genesisBalances) {
        CurrencyNetwork network = new CurrencyNetwork(chain);
        parseAmounts(genesisBalances).forEach((account, amount) -> network.credit(Address.of(account), amount));
        return network;
    }

    @Bean
    public SolidValueToken solidValueToken(
            CurrencyNetwork network,
            @Value("${ledger.token.name:Solid Value Token}") String name,
            @Value("${ledger.token.symbol:SVT}") String symbol,
            @Value("${ledger.token.decimals:18}") int decimals,
            @Value("${ledger.token.deployer}") String deployer,
            @Value("${ledger.token.allocations:}") String allocations,
            @Value("${ledger.token.pool-currency:0}") BigInteger poolCurrency) {
        return SolidValueToken.deploy(network, Address.of(deployer), new TokenMetadata(name, symbol, decimals),
            parseAllocations(allocations), poolCurrency);
    }

    @Bean
    public LiquidityLock liquidityLock(CurrencyNetwork network,
                                       @Value("${ledger.liquidity.owner:${ledger.token.deployer}}") String owner) {
        return LiquidityLock.deploy(network, Address.of(owner));
    }

    static List<Allocation> parseAllocations(String pairs) {
        List<Allocation> result = new ArrayList<>();
        parseAmounts(pairs).forEach((key, amount) -> result.add(
            POOL_KEY.equals(key) ? Allocation.toPool(amount) : Allocation.to(Address.of(key), amount)));
        return result;
    }

    /**
     * Parses {@code key=amount,key=amount}. Blank input yields an empty map.
     *
     * @throws IllegalArgumentException on a malformed pair or amount
     */
    static Map<String, BigInteger> parseAmounts(String pairs) {
        Map<String, BigInteger> result = new LinkedHashMap<>();
        if (pairs == null || pairs.isBlank()) {
            return result;
        }
        for (String pair : pairs.split(",")) {
            String[] parts = pair.trim().split("=");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Expected key=amount but was: " + pair);
            }
            try {
                result.merge(parts[0].trim(), new BigInteger(parts[1].trim()), BigInteger::add);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid amount in: " + pair, e);
            }
        }
        return result;
    }
}
