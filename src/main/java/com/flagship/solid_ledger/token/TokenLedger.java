package com.flagship.solid_ledger.token;

import com.flagship.solid_ledger.chain.Address;
import com.flagship.solid_ledger.chain.Amounts;
import com.flagship.solid_ledger.chain.Chain;
import com.flagship.solid_ledger.event.ApprovalEvent;
import com.flagship.solid_ledger.event.TransferEvent;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Balances, allowances and total supply of the unit token.
 *
 * This class enforces the core invariants:
 * 1. totalSupply equals the sum of all balances after every operation
 * 2. No balance goes negative; an over-debit fails before anything changes
 * 3. Every balance change goes through {@link #update}, the single mutation primitive
 *
 * All writes are journaled on the {@link Chain}, so a failure later in the same
 * operation reverts them.
 */
public class TokenLedger {

    private final Chain chain;
    private final Address contract;
    private final SameBlockGuard guard;

    private final Map<Address, BigInteger> balances = new HashMap<>();
    private final Map<Address, Map<Address, BigInteger>> allowances = new HashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;

    public TokenLedger(Chain chain, Address contract, SameBlockGuard guard) {
        this.chain = chain;
        this.contract = contract;
        this.guard = guard;
    }

    public BigInteger balanceOf(Address account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    public BigInteger allowance(Address owner, Address spender) {
        Map<Address, BigInteger> granted = allowances.get(owner);
        return granted == null ? BigInteger.ZERO : granted.getOrDefault(spender, BigInteger.ZERO);
    }

    public BigInteger totalSupply() {
        return totalSupply;
    }

    /**
     * Recomputes the supply from balances. Used by the conservation health check.
     */
    public BigInteger sumOfBalances() {
        return balances.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
    }

    /**
     * Moves, mints or burns units.
     *
     * - from == ZERO mints: the supply grows
     * - to == ZERO burns: the supply shrinks
     * - otherwise units move from one balance to another
     *
     * The debit is applied first and fails the whole operation on underflow.
     * The same-block guard is enforced for the caller of the entry point.
     *
     * @throws LedgerException INSUFFICIENT_BALANCE, SAME_BLOCK_REPLAY or ARITHMETIC_OVERFLOW
     */
    public void update(Address caller, Address from, Address to, BigInteger amount) {
        Amounts.requireValid(amount, "Amount");
        guard.check(caller);

        if (from.isZero()) {
            setTotalSupply(Amounts.checkedAdd(totalSupply, amount));
        } else {
            BigInteger fromBalance = balanceOf(from);
            if (fromBalance.compareTo(amount) < 0) {
                throw new LedgerException(ErrorCode.INSUFFICIENT_BALANCE,
                    String.format("Balance of %s is %s, cannot debit %s", from, fromBalance, amount));
            }
            setBalance(from, fromBalance.subtract(amount));
        }

        if (to.isZero()) {
            setTotalSupply(totalSupply.subtract(amount));
        } else {
            setBalance(to, balanceOf(to).add(amount));
        }

        chain.emit(TransferEvent.of(contract, chain.currentBlock(), from, to, amount));
    }

    /**
     * @throws LedgerException ZERO_ADDRESS if the account is the null identity
     */
    public void mint(Address caller, Address account, BigInteger amount) {
        if (account.isZero()) {
            throw new LedgerException(ErrorCode.ZERO_ADDRESS, "Cannot mint to the zero address");
        }
        update(caller, Address.ZERO, account, amount);
    }

    /**
     * @throws LedgerException ZERO_ADDRESS or INSUFFICIENT_BALANCE
     */
    public void burn(Address caller, Address account, BigInteger amount) {
        if (account.isZero()) {
            throw new LedgerException(ErrorCode.ZERO_ADDRESS, "Cannot burn from the zero address");
        }
        update(caller, account, Address.ZERO, amount);
    }

    /**
     * Sets the allowance unconditionally (no check of the previous value).
     *
     * @throws LedgerException ZERO_ADDRESS if owner or spender is the null identity
     */
    public void approve(Address owner, Address spender, BigInteger amount) {
        Amounts.requireValid(amount, "Allowance");
        if (owner.isZero() || spender.isZero()) {
            throw new LedgerException(ErrorCode.ZERO_ADDRESS,
                String.format("Approval requires non-zero owner and spender: owner=%s, spender=%s", owner, spender));
        }
        setAllowance(owner, spender, amount);
        chain.emit(ApprovalEvent.of(contract, chain.currentBlock(), owner, spender, amount));
    }

    /**
     * Consumes allowance. An allowance of {@link Amounts#MAX_UINT256} is infinite
     * and is left untouched.
     *
     * @throws LedgerException INSUFFICIENT_ALLOWANCE
     */
    public void spendAllowance(Address owner, Address spender, BigInteger amount) {
        BigInteger current = allowance(owner, spender);
        if (current.equals(Amounts.MAX_UINT256)) {
            return;
        }
        if (current.compareTo(amount) < 0) {
            throw new LedgerException(ErrorCode.INSUFFICIENT_ALLOWANCE,
                String.format("Allowance of %s for %s is %s, cannot spend %s", spender, owner, current, amount));
        }
        setAllowance(owner, spender, current.subtract(amount));
    }

    private void setBalance(Address account, BigInteger newBalance) {
        BigInteger previous = newBalance.signum() == 0
            ? balances.remove(account)
            : balances.put(account, newBalance);
        chain.journal(() -> {
            if (previous == null) {
                balances.remove(account);
            } else {
                balances.put(account, previous);
            }
        });
    }

    private void setTotalSupply(BigInteger newSupply) {
        BigInteger previous = totalSupply;
        totalSupply = newSupply;
        chain.journal(() -> totalSupply = previous);
    }

    private void setAllowance(Address owner, Address spender, BigInteger amount) {
        Map<Address, BigInteger> granted = allowances.computeIfAbsent(owner, k -> new HashMap<>());
        BigInteger previous = granted.put(spender, amount);
        chain.journal(() -> {
            if (previous == null) {
                granted.remove(spender);
            } else {
                granted.put(spender, previous);
            }
        });
    }
}
