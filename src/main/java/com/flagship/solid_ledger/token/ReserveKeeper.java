package com.flagship.solid_ledger.token;

import com.flagship.solid_ledger.chain.Address;
import com.flagship.solid_ledger.chain.Amounts;
import com.flagship.solid_ledger.chain.CurrencyNetwork;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Custodian of the currency that backs the solid value of each unit.
 *
 * - Anyone may deposit, unconditionally; plain sends to its address are deposits too
 * - Only the controller (the token that created it) may withdraw
 *
 * The keeper holds the controller's address, not a reference to the token:
 * authority is a capability check, ownership runs one way.
 */
@Slf4j
public class ReserveKeeper {

    private final Address address;
    private final Address controller;
    private final CurrencyNetwork network;

    public ReserveKeeper(Address address, Address controller, CurrencyNetwork network) {
        this.address = address;
        this.controller = controller;
        this.network = network;
        network.registerRecipient(address, (from, amount) ->
            log.debug("Reserve deposit received: from={}, amount={}", from, amount));
    }

    public Address getAddress() {
        return address;
    }

    public Address getController() {
        return controller;
    }

    public BigInteger reserveBalance() {
        return network.balanceOf(address);
    }

    /**
     * Accepts any amount from the sender.
     *
     * @throws LedgerException TRANSFER_FAILED if the sender lacks the currency
     */
    public void deposit(Address sender, BigInteger amount) {
        network.attachValue(sender, address, amount);
    }

    /**
     * Pays reserve currency to a recipient. The reserve decrement and the payout
     * commit together or not at all.
     *
     * @throws LedgerException UNAUTHORIZED, INSUFFICIENT_RESERVE or TRANSFER_FAILED
     */
    public void withdraw(Address caller, Address to, BigInteger amount) {
        Amounts.requireValid(amount, "Withdrawal amount");
        if (!controller.equals(caller)) {
            log.warn("Unauthorized reserve withdrawal attempt: caller={}, controller={}", caller, controller);
            throw new LedgerException(ErrorCode.UNAUTHORIZED,
                String.format("Only the controller %s may withdraw, caller was %s", controller, caller));
        }
        BigInteger reserve = reserveBalance();
        if (amount.compareTo(reserve) > 0) {
            throw new LedgerException(ErrorCode.INSUFFICIENT_RESERVE,
                String.format("Reserve is %s, cannot withdraw %s", reserve, amount));
        }
        network.transfer(address, to, amount);
        log.debug("Reserve withdrawal: to={}, amount={}", to, amount);
    }
}
