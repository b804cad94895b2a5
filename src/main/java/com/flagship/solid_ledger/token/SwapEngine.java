package com.flagship.solid_ledger.token;

import com.flagship.solid_ledger.chain.Amounts;

import java.math.BigInteger;

/**
 * Constant-product pricing over the contract's own reserves.
 *
 * Buy (currency in, units out):  out = value * units / (currency + value)
 * Sell (units in, currency out): out = value * currency / (units + value)
 *
 * Integer division rounds down. Reserves are passed in fresh on every call.
 */
public final class SwapEngine {

    private SwapEngine() {
        // Utility class
    }

    /**
     * Quotes a trade against the given reserves.
     *
     * @param value amount paid in (currency when buying, units when selling)
     * @param isBuy true when paying currency to receive units
     * @return amount received; zero when the pool and the input are both empty
     */
    public static BigInteger quote(BigInteger value, boolean isBuy, Reserves reserves) {
        Amounts.requireValid(value, "Value");
        BigInteger reserveIn = isBuy ? reserves.getCurrency() : reserves.getUnits();
        BigInteger reserveOut = isBuy ? reserves.getUnits() : reserves.getCurrency();

        BigInteger denominator = reserveIn.add(value);
        if (denominator.signum() == 0) {
            return BigInteger.ZERO;
        }
        return value.multiply(reserveOut).divide(denominator);
    }
}
