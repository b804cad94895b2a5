package com.flagship.solid_ledger.chain;

import java.math.BigInteger;

/**
 * Logic attached to an address that runs when it receives a plain currency send.
 *
 * Throwing rejects the send. The hook runs while the sender's operation is still
 * open, so it may call back into contracts (the reentrancy suspension point).
 */
@FunctionalInterface
public interface CurrencyRecipient {

    void onReceive(Address from, BigInteger amount);
}
