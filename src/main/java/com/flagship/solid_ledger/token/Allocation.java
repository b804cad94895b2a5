package com.flagship.solid_ledger.token;

import com.flagship.solid_ledger.chain.Address;
import com.flagship.solid_ledger.chain.Amounts;
import lombok.Value;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Units minted at deployment. Nothing else ever mints, so the swap pool only has
 * units to sell if an allocation goes to the pool.
 */
@Value
public class Allocation {
    Address account;    // null for the pool
    BigInteger amount;

    private Allocation(Address account, BigInteger amount) {
        this.account = account;
        this.amount = Amounts.requireValid(amount, "Allocation amount");
    }

    public static Allocation to(Address account, BigInteger amount) {
        return new Allocation(Objects.requireNonNull(account, "account"), amount);
    }

    /**
     * Allocation to the token contract itself, i.e. the unit side of the swap pool.
     */
    public static Allocation toPool(BigInteger amount) {
        return new Allocation(null, amount);
    }

    public boolean isPool() {
        return account == null;
    }
}
