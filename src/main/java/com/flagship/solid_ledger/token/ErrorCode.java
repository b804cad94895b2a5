package com.flagship.solid_ledger.token;

/**
 * Failure codes of ledger, swap, custodian and lock operations.
 *
 * Every failure aborts the whole operation; no code is a warning.
 */
public enum ErrorCode {

    /** Caller's unit balance is below the requested amount. */
    INSUFFICIENT_BALANCE("Insufficient balance"),

    /** Spender's allowance is below the requested amount. */
    INSUFFICIENT_ALLOWANCE("Insufficient allowance"),

    /** Operation targets the null identity where it is not permitted. */
    ZERO_ADDRESS("Zero address not allowed"),

    /** A value-bearing call supplied zero where a positive amount is required. */
    ZERO_VALUE_NOT_ALLOWED("Zero value not allowed"),

    /** Caller already performed a mutating call in the current block. */
    SAME_BLOCK_REPLAY("Same block replay"),

    /** Per-unit value requested while total supply is zero. */
    UNDEFINED_VALUE("Undefined value"),

    /** Sell quote rounds down to zero currency. */
    SELL_TOO_LOW("Sell amount too low"),

    /** Buy quote rounds down to zero units. */
    BUY_TOO_LOW("Buy amount too low"),

    /** Not enough currency held to satisfy a payout. */
    INSUFFICIENT_RESERVE("Insufficient reserve"),

    /** Caller is not the controller or owner. */
    UNAUTHORIZED("Unauthorized"),

    /** Liquidity was already added to the lock. */
    ALREADY_ADDED("Liquidity already added"),

    /** Lock operation with nothing deposited. */
    NO_VALUE_SENT("No value sent"),

    /** Unlock block is not in the future. */
    BLOCK_TOO_LOW("Unlock block too low"),

    /** New unlock block does not extend the current one. */
    CANNOT_SHORTEN("Lock cannot be shortened"),

    /** Liquidity is still locked. */
    LOCKED("Liquidity is locked"),

    /** Lock has no liquidity to extend or remove. */
    NOTHING_LOCKED("Nothing locked"),

    /** A mutating operation was entered while another one is suspended on a payout. */
    REENTRANT_CALL("Reentrant call"),

    /** A balance or the supply would exceed uint256. */
    ARITHMETIC_OVERFLOW("Arithmetic overflow"),

    /** The underlying currency transfer did not succeed. */
    TRANSFER_FAILED("Transfer failed");

    private final String title;

    ErrorCode(String title) {
        this.title = title;
    }

    public String getTitle() {
        return title;
    }
}
