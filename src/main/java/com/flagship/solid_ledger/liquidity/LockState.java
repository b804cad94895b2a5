package com.flagship.solid_ledger.liquidity;

/**
 * Lifecycle of the liquidity lock.
 *
 * UNSET → LOCKED → UNLOCKABLE. Extending the lock can move UNLOCKABLE back to LOCKED.
 */
public enum LockState {
    /**
     * No liquidity added yet. Initial state.
     */
    UNSET,

    /**
     * Liquidity deposited; the unlock block has not passed.
     */
    LOCKED,

    /**
     * The current block is past the unlock block; the owner may withdraw.
     */
    UNLOCKABLE
}
