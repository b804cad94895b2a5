package com.flagship.solid_ledger.chain;

import com.flagship.solid_ledger.token.ErrorCode;
import com.flagship.solid_ledger.token.LedgerException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Backing-currency balances of every address.
 *
 * Two ways to move currency:
 * - attachValue: value accompanying a call, no recipient logic runs
 * - send/transfer: plain send, the recipient's hook (if any) runs in a nested frame
 *
 * All balance changes are journaled on the {@link Chain}, so they revert with the
 * operation that made them.
 */
@Slf4j
public class CurrencyNetwork {

    private final Chain chain;
    private final Map<Address, BigInteger> balances = new HashMap<>();
    private final Map<Address, CurrencyRecipient> recipients = new ConcurrentHashMap<>();

    public CurrencyNetwork(Chain chain) {
        this.chain = chain;
    }

    public Chain getChain() {
        return chain;
    }

    public BigInteger balanceOf(Address account) {
        Objects.requireNonNull(account, "account");
        return chain.read(() -> balances.getOrDefault(account, BigInteger.ZERO));
    }

    public void registerRecipient(Address address, CurrencyRecipient recipient) {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(recipient, "recipient");
        recipients.put(address, recipient);
    }

    /**
     * Funds an address out of thin air. Genesis bootstrap only.
     */
    public void credit(Address account, BigInteger amount) {
        Amounts.requireValid(amount, "Credit amount");
        chain.run(() -> adjust(account, Amounts.checkedAdd(balanceOf(account), amount)));
        log.info("Genesis credit: account={}, amount={}", account, amount);
    }

    /**
     * Moves value that accompanies a call. Recipient logic does not run.
     *
     * @throws LedgerException TRANSFER_FAILED if the sender lacks funds
     */
    public void attachValue(Address from, Address to, BigInteger amount) {
        Amounts.requireValid(amount, "Value");
        chain.run(() -> {
            if (!move(from, to, amount)) {
                throw new LedgerException(ErrorCode.TRANSFER_FAILED,
                    String.format("Insufficient currency to attach value: from=%s, amount=%s", from, amount));
            }
        });
    }

    /**
     * Plain send. Runs the recipient hook after crediting it.
     *
     * @return false if the sender lacks funds or the recipient rejected the send;
     *         in that case nothing changed
     */
    public boolean send(Address from, Address to, BigInteger amount) {
        Amounts.requireValid(amount, "Send amount");
        try {
            return chain.execute(() -> {
                if (!move(from, to, amount)) {
                    return false;
                }
                CurrencyRecipient recipient = recipients.get(to);
                if (recipient != null) {
                    recipient.onReceive(from, amount);
                }
                return true;
            });
        } catch (RuntimeException e) {
            log.warn("Currency send rejected by recipient: from={}, to={}, amount={}, reason={}",
                from, to, amount, e.getMessage());
            return false;
        }
    }

    /**
     * Plain send that fails the caller's operation when it does not succeed.
     *
     * @throws LedgerException TRANSFER_FAILED
     */
    public void transfer(Address from, Address to, BigInteger amount) {
        if (!send(from, to, amount)) {
            throw new LedgerException(ErrorCode.TRANSFER_FAILED,
                String.format("Currency transfer failed: from=%s, to=%s, amount=%s", from, to, amount));
        }
    }

    private boolean move(Address from, Address to, BigInteger amount) {
        BigInteger fromBalance = balances.getOrDefault(from, BigInteger.ZERO);
        if (fromBalance.compareTo(amount) < 0) {
            return false;
        }
        if (from.equals(to)) {
            return true;
        }
        adjust(from, fromBalance.subtract(amount));
        adjust(to, Amounts.checkedAdd(balances.getOrDefault(to, BigInteger.ZERO), amount));
        return true;
    }

    private void adjust(Address account, BigInteger newBalance) {
        BigInteger previous = balances.put(account, newBalance);
        chain.journal(() -> restore(account, previous));
    }

    private void restore(Address account, BigInteger previous) {
        if (previous == null) {
            balances.remove(account);
        } else {
            balances.put(account, previous);
        }
    }
}
