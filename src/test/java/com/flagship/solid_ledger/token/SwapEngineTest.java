package com.flagship.solid_ledger.token;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class SwapEngineTest {

    private static BigInteger big(long value) {
        return BigInteger.valueOf(value);
    }

    @Test
    @DisplayName("Buy quote: value * unitReserve / (currencyReserve + value), rounded down")
    void testBuyQuote() {
        Reserves reserves = new Reserves(big(1_000), big(500));

        assertEquals(big(45), SwapEngine.quote(big(100), true, reserves));
    }

    @Test
    @DisplayName("Sell quote: value * currencyReserve / (unitReserve + value), rounded down")
    void testSellQuote() {
        Reserves reserves = new Reserves(big(1_000), big(500));

        assertEquals(big(166), SwapEngine.quote(big(100), false, reserves));
    }

    @Test
    @DisplayName("Empty pool and zero input quote zero instead of dividing by zero")
    void testZeroDenominator() {
        Reserves empty = new Reserves(BigInteger.ZERO, BigInteger.ZERO);

        assertEquals(BigInteger.ZERO, SwapEngine.quote(BigInteger.ZERO, true, empty));
        assertEquals(BigInteger.ZERO, SwapEngine.quote(BigInteger.ZERO, false, empty));
    }

    @Test
    @DisplayName("Quote never drains the output reserve")
    void testQuoteBelowReserve() {
        Reserves reserves = new Reserves(big(10), big(10));

        BigInteger out = SwapEngine.quote(big(1_000_000), true, reserves);

        assertTrue(out.compareTo(reserves.getUnits()) < 0);
    }

    @Test
    @DisplayName("Negative input is rejected")
    void testNegativeRejected() {
        Reserves reserves = new Reserves(big(10), big(10));

        assertThrows(IllegalArgumentException.class, () -> SwapEngine.quote(big(-1), true, reserves));
    }
}
