package com.flagship.solid_ledger.chain;

/**
 * Source of the current block number.
 *
 * Injected everywhere a block is read so tests can drive block progression
 * deterministically instead of depending on a wall clock.
 */
@FunctionalInterface
public interface BlockSource {

    long currentBlock();
}
