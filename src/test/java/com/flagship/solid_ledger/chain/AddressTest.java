package com.flagship.solid_ledger.chain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AddressTest {

    @Test
    @DisplayName("Parsing normalizes to lowercase and compares by value")
    void testParseNormalizes() {
        Address upper = Address.of("0x00000000000000000000000000000000000000AB");
        Address lower = Address.of("0x00000000000000000000000000000000000000ab");

        assertEquals(lower, upper);
        assertEquals("0x00000000000000000000000000000000000000ab", upper.toString());
    }

    @Test
    @DisplayName("Malformed addresses are rejected")
    void testMalformedRejected() {
        assertThrows(IllegalArgumentException.class, () -> Address.of("0x1234"));
        assertThrows(IllegalArgumentException.class, () -> Address.of("00000000000000000000000000000000000000ab"));
        assertThrows(IllegalArgumentException.class, () -> Address.of("0xzz000000000000000000000000000000000000ab"));
        assertThrows(IllegalArgumentException.class, () -> Address.of(null));
    }

    @Test
    @DisplayName("Derived addresses are deterministic and distinct per label")
    void testDerive() {
        assertEquals(Address.derive("alice"), Address.derive("alice"));
        assertNotEquals(Address.derive("alice"), Address.derive("bob"));
        assertFalse(Address.derive("alice").isZero());
        assertTrue(Address.ZERO.isZero());
    }
}
