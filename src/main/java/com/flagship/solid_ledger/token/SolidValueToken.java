package com.flagship.solid_ledger.token;

import com.flagship.solid_ledger.chain.Address;
import com.flagship.solid_ledger.chain.Amounts;
import com.flagship.solid_ledger.chain.Chain;
import com.flagship.solid_ledger.chain.CurrencyNetwork;
import com.flagship.solid_ledger.event.SwapEvent;
import com.flagship.solid_ledger.event.ValueEnhancedEvent;
import com.flagship.solid_ledger.event.ValueRetrievedEvent;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.List;
import java.util.OptionalLong;
import java.util.function.Supplier;

/**
 * Unit token whose per-unit value is backed by a dedicated currency reserve,
 * with a constant-product market against its own holdings.
 *
 * State kept consistent across every operation:
 * - the balance ledger ({@link TokenLedger})
 * - the reserve held by the {@link ReserveKeeper}
 * - the pool: this contract's own currency balance and own unit balance
 * - the same-block guard ({@link SameBlockGuard})
 *
 * Every entry point runs as one {@link Chain} frame: it either commits entirely
 * or leaves no trace. Mutating entry points also hold a contract-wide
 * non-reentrancy flag, so a recipient that calls back during a payout is rejected.
 * Views stay callable during a payout and see the state committed so far.
 */
@Slf4j
public class SolidValueToken {

    private final TokenMetadata metadata;
    private final Address address;
    private final Chain chain;
    private final CurrencyNetwork network;
    private final SameBlockGuard guard;
    private final TokenLedger ledger;
    private final ReserveKeeper keeper;

    // Guarded by the chain lock
    private boolean entered;

    private SolidValueToken(TokenMetadata metadata, Address address, CurrencyNetwork network) {
        this.metadata = metadata;
        this.address = address;
        this.network = network;
        this.chain = network.getChain();
        this.guard = new SameBlockGuard(chain);
        this.ledger = new TokenLedger(chain, address, guard);
        this.keeper = new ReserveKeeper(Address.derive("reserve-keeper:" + address), address, network);
    }

    /**
     * Deploys the token.
     *
     * Mints the initial allocations, seeds the pool with the currency the deployer
     * attaches, creates the reserve keeper with this token as controller, and makes
     * plain currency sends to the token's address buy units.
     *
     * @param poolCurrency currency attached by the deployer, kept as the pool's currency side
     */
    public static SolidValueToken deploy(CurrencyNetwork network, Address deployer, TokenMetadata metadata,
                                         List<Allocation> allocations, BigInteger poolCurrency) {
        Address address = Address.derive("solid-value-token:" + metadata.getSymbol() + ":" + deployer);
        SolidValueToken token = new SolidValueToken(metadata, address, network);

        network.getChain().run(() -> {
            if (poolCurrency.signum() > 0) {
                network.attachValue(deployer, address, poolCurrency);
            }
            for (Allocation allocation : allocations) {
                Address account = allocation.isPool() ? address : allocation.getAccount();
                token.ledger.mint(deployer, account, allocation.getAmount());
            }
        });
        network.registerRecipient(address, token::receive);

        log.info("Deployed {} ({}) at {}: supply={}, poolUnits={}, poolCurrency={}, keeper={}",
            metadata.getName(), metadata.getSymbol(), address, token.totalSupply(),
            token.balanceOf(address), poolCurrency, token.keeper.getAddress());
        return token;
    }

    // ==================== Ledger entry points ====================

    /**
     * Transfers units. A transfer to this contract's address sells the units to the pool.
     *
     * @throws LedgerException INSUFFICIENT_BALANCE, SAME_BLOCK_REPLAY, REENTRANT_CALL,
     *                         or the sell failures
     */
    public boolean transfer(Address caller, Address to, BigInteger amount) {
        return mutate(() -> {
            if (to.equals(address)) {
                sell(caller, amount);
            } else {
                ledger.update(caller, caller, to, amount);
            }
            return true;
        });
    }

    public boolean approve(Address caller, Address spender, BigInteger amount) {
        return mutate(() -> {
            ledger.approve(caller, spender, amount);
            return true;
        });
    }

    /**
     * Moves units on behalf of {@code from}, consuming the caller's allowance.
     * A transfer to this contract's address is a plain move here, not a sell.
     *
     * @throws LedgerException INSUFFICIENT_ALLOWANCE, INSUFFICIENT_BALANCE, SAME_BLOCK_REPLAY
     */
    public boolean transferFrom(Address caller, Address from, Address to, BigInteger amount) {
        return mutate(() -> {
            Amounts.requireValid(amount, "Amount");
            ledger.spendAllowance(from, caller, amount);
            ledger.update(caller, from, to, amount);
            return true;
        });
    }

    // ==================== Solid value ====================

    /**
     * Forwards the attached currency to the reserve keeper, raising the per-unit
     * value for every holder.
     *
     * @throws LedgerException ZERO_VALUE_NOT_ALLOWED or TRANSFER_FAILED
     */
    public void enhanceTokenValue(Address caller, BigInteger value) {
        mutate(() -> {
            Amounts.requireValid(value, "Value");
            if (Amounts.isZero(value)) {
                throw new LedgerException(ErrorCode.ZERO_VALUE_NOT_ALLOWED, "Enhancement value must be positive");
            }
            network.attachValue(caller, address, value);
            keeper.deposit(address, value);
            chain.emit(ValueEnhancedEvent.of(address, chain.currentBlock(), caller, value));
            return null;
        });
        log.debug("Token value enhanced: contributor={}, amount={}", caller, value);
    }

    /**
     * Burns units and pays out their share of the reserve.
     *
     * The payout is computed against the supply before the burn:
     * payout = reserve * amount / totalSupply.
     *
     * @return the currency paid out
     * @throws LedgerException ZERO_VALUE_NOT_ALLOWED, UNDEFINED_VALUE, INSUFFICIENT_BALANCE,
     *                         SAME_BLOCK_REPLAY or TRANSFER_FAILED
     */
    public BigInteger retrieveTokenValue(Address caller, BigInteger amount) {
        return mutate(() -> {
            Amounts.requireValid(amount, "Amount");
            if (Amounts.isZero(amount)) {
                throw new LedgerException(ErrorCode.ZERO_VALUE_NOT_ALLOWED, "Retrieved amount must be positive");
            }
            BigInteger supply = ledger.totalSupply();
            if (supply.signum() == 0) {
                throw new LedgerException(ErrorCode.UNDEFINED_VALUE, "Solid value is undefined with zero supply");
            }
            BigInteger balance = ledger.balanceOf(caller);
            if (balance.compareTo(amount) < 0) {
                throw new LedgerException(ErrorCode.INSUFFICIENT_BALANCE,
                    String.format("Balance of %s is %s, cannot retrieve %s", caller, balance, amount));
            }

            BigInteger payout = keeper.reserveBalance().multiply(amount).divide(supply);
            ledger.burn(caller, caller, amount);
            keeper.withdraw(address, caller, payout);

            chain.emit(ValueRetrievedEvent.of(address, chain.currentBlock(), caller, amount, payout));
            return payout;
        });
    }

    // ==================== Swap ====================

    /**
     * Buys units with the attached currency (the incoming-value entry point).
     *
     * @return units received
     * @throws LedgerException ZERO_VALUE_NOT_ALLOWED, BUY_TOO_LOW, SAME_BLOCK_REPLAY or TRANSFER_FAILED
     */
    public BigInteger buy(Address caller, BigInteger value) {
        return mutate(() -> {
            Amounts.requireValid(value, "Value");
            if (Amounts.isZero(value)) {
                throw new LedgerException(ErrorCode.ZERO_VALUE_NOT_ALLOWED, "Buy value must be positive");
            }
            network.attachValue(caller, address, value);
            return settleBuy(caller, value);
        });
    }

    /**
     * Recipient hook for plain sends to this contract: the currency is already
     * credited when this runs.
     */
    private void receive(Address from, BigInteger value) {
        mutate(() -> {
            if (Amounts.isZero(value)) {
                throw new LedgerException(ErrorCode.ZERO_VALUE_NOT_ALLOWED, "Buy value must be positive");
            }
            return settleBuy(from, value);
        });
    }

    private BigInteger settleBuy(Address buyer, BigInteger value) {
        // Price against the currency reserve as it was before this value arrived
        BigInteger currencyBeforeDeposit = network.balanceOf(address).subtract(value);
        Reserves reserves = new Reserves(currencyBeforeDeposit, ledger.balanceOf(address));
        BigInteger unitsOut = SwapEngine.quote(value, true, reserves);
        if (Amounts.isZero(unitsOut)) {
            throw new LedgerException(ErrorCode.BUY_TOO_LOW,
                String.format("Buying with %s yields zero units against reserves %s", value, reserves));
        }

        ledger.update(buyer, address, buyer, unitsOut);
        chain.emit(SwapEvent.of(address, chain.currentBlock(), buyer,
            value, BigInteger.ZERO, BigInteger.ZERO, unitsOut));
        log.debug("Buy settled: buyer={}, currencyIn={}, unitsOut={}", buyer, value, unitsOut);
        return unitsOut;
    }

    /**
     * Sells units to the pool. Units are taken before the currency payout is
     * attempted; a failed payout reverts the whole sell.
     */
    private void sell(Address seller, BigInteger amount) {
        Amounts.requireValid(amount, "Amount");
        BigInteger currencyOut = SwapEngine.quote(amount, false, reserves());
        if (Amounts.isZero(currencyOut)) {
            throw new LedgerException(ErrorCode.SELL_TOO_LOW,
                String.format("Selling %s units yields zero currency", amount));
        }
        BigInteger poolCurrency = network.balanceOf(address);
        if (poolCurrency.compareTo(currencyOut) < 0) {
            throw new LedgerException(ErrorCode.INSUFFICIENT_RESERVE,
                String.format("Pool holds %s, cannot pay %s", poolCurrency, currencyOut));
        }

        ledger.update(seller, seller, address, amount);
        network.transfer(address, seller, currencyOut);

        chain.emit(SwapEvent.of(address, chain.currentBlock(), seller,
            BigInteger.ZERO, amount, currencyOut, BigInteger.ZERO));
        log.debug("Sell settled: seller={}, unitsIn={}, currencyOut={}", seller, amount, currencyOut);
    }

    private <T> T mutate(Supplier<T> body) {
        return chain.execute(() -> {
            if (entered) {
                throw new LedgerException(ErrorCode.REENTRANT_CALL,
                    "Token operation entered while another one is in progress");
            }
            entered = true;
            try {
                return body.get();
            } finally {
                entered = false;
            }
        });
    }

    // ==================== Views ====================

    public Address getAddress() {
        return address;
    }

    public ReserveKeeper getReserveKeeper() {
        return keeper;
    }

    public String name() {
        return metadata.getName();
    }

    public String symbol() {
        return metadata.getSymbol();
    }

    public int decimals() {
        return metadata.getDecimals();
    }

    public BigInteger balanceOf(Address account) {
        return chain.read(() -> ledger.balanceOf(account));
    }

    public BigInteger allowance(Address owner, Address spender) {
        return chain.read(() -> ledger.allowance(owner, spender));
    }

    public BigInteger totalSupply() {
        return chain.read(ledger::totalSupply);
    }

    public BigInteger sumOfBalances() {
        return chain.read(ledger::sumOfBalances);
    }

    public SupplySnapshot supplySnapshot() {
        return chain.read(() -> new SupplySnapshot(ledger.totalSupply(), ledger.sumOfBalances(), keeper.reserveBalance()));
    }

    public boolean isConserved() {
        return supplySnapshot().isConserved();
    }

    /**
     * Currency held by the reserve keeper on behalf of all holders.
     */
    public BigInteger solidValue() {
        return keeper.reserveBalance();
    }

    /**
     * Reserve currency per unit, rounded down.
     *
     * @throws LedgerException UNDEFINED_VALUE when the supply is zero
     */
    public BigInteger solidValuePerUnit() {
        return chain.read(() -> {
            BigInteger supply = ledger.totalSupply();
            if (supply.signum() == 0) {
                throw new LedgerException(ErrorCode.UNDEFINED_VALUE, "Solid value is undefined with zero supply");
            }
            return keeper.reserveBalance().divide(supply);
        });
    }

    public Reserves getReserves() {
        return chain.read(this::reserves);
    }

    public BigInteger getAmountOut(BigInteger value, boolean isBuy) {
        return chain.read(() -> SwapEngine.quote(value, isBuy, reserves()));
    }

    public OptionalLong lastMutationBlock(Address account) {
        return guard.lastMutationBlock(account);
    }

    private Reserves reserves() {
        return new Reserves(network.balanceOf(address), ledger.balanceOf(address));
    }
}
