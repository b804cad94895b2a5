package com.flagship.solid_ledger.token;

import lombok.Value;

import java.math.BigInteger;

/**
 * Snapshot of the constant-product pool: the token contract's own currency
 * balance and its own unit balance.
 */
@Value
public class Reserves {
    BigInteger currency;
    BigInteger units;
}
