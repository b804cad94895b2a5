package com.flagship.solid_ledger.token;

import lombok.Value;

/**
 * Display metadata. Immutable after deployment.
 */
@Value
public class TokenMetadata {
    String name;
    String symbol;
    int decimals;

    public TokenMetadata(String name, String symbol, int decimals) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Token name is required");
        }
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Token symbol is required");
        }
        if (decimals < 0 || decimals > 255) {
            throw new IllegalArgumentException("Decimals must fit in uint8: " + decimals);
        }
        this.name = name;
        this.symbol = symbol;
        this.decimals = decimals;
    }
}
