package com.flagship.solid_ledger.chain;

import com.flagship.solid_ledger.token.ErrorCode;
import com.flagship.solid_ledger.token.LedgerException;

import java.math.BigInteger;

/**
 * Unsigned 256-bit arithmetic helpers for unit and currency amounts.
 */
public final class Amounts {

    /**
     * Largest representable amount. As an allowance it means "infinite approval".
     */
    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private Amounts() {
        // Utility class
    }

    /**
     * Validates that an amount is a uint256.
     *
     * @throws IllegalArgumentException if null, negative or above {@link #MAX_UINT256}
     */
    public static BigInteger requireValid(BigInteger amount, String name) {
        if (amount == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        if (amount.signum() < 0) {
            throw new IllegalArgumentException(name + " cannot be negative: " + amount);
        }
        if (amount.compareTo(MAX_UINT256) > 0) {
            throw new IllegalArgumentException(name + " exceeds uint256: " + amount);
        }
        return amount;
    }

    /**
     * Adds two amounts, failing with ARITHMETIC_OVERFLOW past {@link #MAX_UINT256}.
     */
    public static BigInteger checkedAdd(BigInteger a, BigInteger b) {
        BigInteger sum = a.add(b);
        if (sum.compareTo(MAX_UINT256) > 0) {
            throw new LedgerException(ErrorCode.ARITHMETIC_OVERFLOW,
                String.format("Addition overflows uint256: %s + %s", a, b));
        }
        return sum;
    }

    public static boolean isZero(BigInteger amount) {
        return amount.signum() == 0;
    }
}
