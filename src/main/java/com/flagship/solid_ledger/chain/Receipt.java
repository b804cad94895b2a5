package com.flagship.solid_ledger.chain;

import lombok.Value;

/**
 * Outcome of a committed execution and the block it ran in.
 */
@Value
public class Receipt<T> {
    T result;
    long block;
}
