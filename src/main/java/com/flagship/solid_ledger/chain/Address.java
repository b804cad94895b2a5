package com.flagship.solid_ledger.chain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Account identity on the simulated chain.
 *
 * An address is 20 bytes, rendered as {@code 0x} followed by 40 lowercase hex digits.
 * {@link #ZERO} is the null identity: minting comes from it, burning goes to it,
 * and operations that must name a real account reject it.
 */
@EqualsAndHashCode
public final class Address {

    private static final Pattern HEX_ADDRESS = Pattern.compile("^0x[0-9a-f]{40}$");
    private static final int LENGTH = 20;

    public static final Address ZERO = new Address("0x" + "0".repeat(LENGTH * 2));

    private final String hex;

    private Address(String hex) {
        this.hex = hex;
    }

    /**
     * Parses an address. Case-insensitive; the canonical form is lowercase.
     *
     * @throws IllegalArgumentException if the string is not a 20-byte hex address
     */
    @JsonCreator
    public static Address of(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Address cannot be null");
        }
        String normalized = value.trim().toLowerCase();
        if (!HEX_ADDRESS.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        return new Address(normalized);
    }

    /**
     * Derives a deterministic address from a label, used for contract deployments.
     * Takes the first 20 bytes of the SHA-256 of the label.
     */
    public static Address derive(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Label is required to derive an address");
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                .digest(label.getBytes(StandardCharsets.UTF_8));
            byte[] truncated = new byte[LENGTH];
            System.arraycopy(digest, 0, truncated, 0, LENGTH);
            return new Address("0x" + HexFormat.of().formatHex(truncated));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public boolean isZero() {
        return this.equals(ZERO);
    }

    @JsonValue
    @Override
    public String toString() {
        return hex;
    }
}
