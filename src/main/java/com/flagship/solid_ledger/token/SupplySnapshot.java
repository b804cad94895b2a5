package com.flagship.solid_ledger.token;

import lombok.Value;

import java.math.BigInteger;

/**
 * Supply figures read together under one lock, so no commit falls between them.
 */
@Value
public class SupplySnapshot {
    BigInteger totalSupply;
    BigInteger sumOfBalances;
    BigInteger reserve;

    public boolean isConserved() {
        return totalSupply.equals(sumOfBalances);
    }
}
