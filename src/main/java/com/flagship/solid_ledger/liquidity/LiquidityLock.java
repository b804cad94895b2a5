package com.flagship.solid_ledger.liquidity;

import com.flagship.solid_ledger.chain.Address;
import com.flagship.solid_ledger.chain.Amounts;
import com.flagship.solid_ledger.chain.Chain;
import com.flagship.solid_ledger.chain.CurrencyNetwork;
import com.flagship.solid_ledger.event.LiquidityAddedEvent;
import com.flagship.solid_ledger.event.LiquidityExtendedEvent;
import com.flagship.solid_ledger.event.LiquidityRemovedEvent;
import com.flagship.solid_ledger.token.ErrorCode;
import com.flagship.solid_ledger.token.LedgerException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.function.Supplier;

/**
 * Time-locked pool of currency, independent of the token and its reserve keeper.
 *
 * Rules:
 * - Liquidity is added once, together with an unlock block in the future
 * - The unlock block can only move later
 * - Withdrawal is possible once the current block is past the unlock block
 * - All three operations are owner-only and non-reentrant
 *
 * The unlock block is kept after withdrawal; the lock is not reset.
 */
@Slf4j
public class LiquidityLock {

    private static final long UNSET = 0L;

    private final Address address;
    private final Address owner;
    private final Chain chain;
    private final CurrencyNetwork network;

    // Guarded by the chain lock
    private long unlockBlock = UNSET;
    private BigInteger lockedAmount = BigInteger.ZERO;
    private boolean entered;

    public LiquidityLock(Address address, Address owner, CurrencyNetwork network) {
        this.address = address;
        this.owner = owner;
        this.network = network;
        this.chain = network.getChain();
    }

    public static LiquidityLock deploy(CurrencyNetwork network, Address owner) {
        LiquidityLock lock = new LiquidityLock(Address.derive("liquidity-lock:" + owner), owner, network);
        log.info("Deployed liquidity lock at {} owned by {}", lock.address, owner);
        return lock;
    }

    /**
     * Deposits the attached currency and sets the unlock block.
     *
     * @throws LedgerException UNAUTHORIZED, ALREADY_ADDED, NO_VALUE_SENT or BLOCK_TOO_LOW
     */
    public void addLiquidity(Address caller, BigInteger value, long newUnlockBlock) {
        guarded(caller, () -> {
            Amounts.requireValid(value, "Value");
            if (unlockBlock != UNSET) {
                throw new LedgerException(ErrorCode.ALREADY_ADDED,
                    "Liquidity already added with unlock block " + unlockBlock);
            }
            if (Amounts.isZero(value)) {
                throw new LedgerException(ErrorCode.NO_VALUE_SENT, "Adding liquidity requires currency");
            }
            long current = chain.currentBlock();
            if (newUnlockBlock <= current) {
                throw new LedgerException(ErrorCode.BLOCK_TOO_LOW,
                    String.format("Unlock block %d is not after current block %d", newUnlockBlock, current));
            }

            network.attachValue(caller, address, value);
            setUnlockBlock(newUnlockBlock);
            setLockedAmount(value);

            chain.emit(LiquidityAddedEvent.of(address, current, caller, value, newUnlockBlock));
            return null;
        });
        log.info("Liquidity added: amount={}, unlockBlock={}", value, newUnlockBlock);
    }

    /**
     * Moves the unlock block later. May re-lock liquidity that had become unlockable.
     *
     * @throws LedgerException UNAUTHORIZED, NOTHING_LOCKED or CANNOT_SHORTEN
     */
    public void extendLiquidityLock(Address caller, long newUnlockBlock) {
        guarded(caller, () -> {
            if (unlockBlock == UNSET) {
                throw new LedgerException(ErrorCode.NOTHING_LOCKED, "No liquidity has been added");
            }
            if (newUnlockBlock <= unlockBlock) {
                throw new LedgerException(ErrorCode.CANNOT_SHORTEN,
                    String.format("New unlock block %d does not extend %d", newUnlockBlock, unlockBlock));
            }
            long previous = unlockBlock;
            setUnlockBlock(newUnlockBlock);
            chain.emit(LiquidityExtendedEvent.of(address, chain.currentBlock(), previous, newUnlockBlock));
            return null;
        });
        log.info("Liquidity lock extended to block {}", newUnlockBlock);
    }

    /**
     * Pays the lock's whole currency balance to the caller once unlockable.
     *
     * @return the amount paid
     * @throws LedgerException UNAUTHORIZED, NOTHING_LOCKED, LOCKED, REENTRANT_CALL or TRANSFER_FAILED
     */
    public BigInteger removeLiquidity(Address caller) {
        BigInteger removed = guarded(caller, () -> {
            if (unlockBlock == UNSET) {
                throw new LedgerException(ErrorCode.NOTHING_LOCKED, "No liquidity has been added");
            }
            long current = chain.currentBlock();
            if (current <= unlockBlock) {
                throw new LedgerException(ErrorCode.LOCKED,
                    String.format("Liquidity locked until block %d, current block is %d", unlockBlock, current));
            }
            BigInteger amount = network.balanceOf(address);
            if (Amounts.isZero(amount)) {
                throw new LedgerException(ErrorCode.NOTHING_LOCKED, "Liquidity was already removed");
            }

            setLockedAmount(BigInteger.ZERO);
            network.transfer(address, caller, amount);

            chain.emit(LiquidityRemovedEvent.of(address, current, caller, amount));
            return amount;
        });
        log.info("Liquidity removed: amount={}", removed);
        return removed;
    }

    private <T> T guarded(Address caller, Supplier<T> body) {
        return chain.execute(() -> {
            if (entered) {
                throw new LedgerException(ErrorCode.REENTRANT_CALL,
                    "Liquidity lock entered while another operation is in progress");
            }
            if (!owner.equals(caller)) {
                throw new LedgerException(ErrorCode.UNAUTHORIZED,
                    String.format("Only the owner %s may manage liquidity, caller was %s", owner, caller));
            }
            entered = true;
            try {
                return body.get();
            } finally {
                entered = false;
            }
        });
    }

    private void setUnlockBlock(long block) {
        long previous = unlockBlock;
        unlockBlock = block;
        chain.journal(() -> unlockBlock = previous);
    }

    private void setLockedAmount(BigInteger amount) {
        BigInteger previous = lockedAmount;
        lockedAmount = amount;
        chain.journal(() -> lockedAmount = previous);
    }

    // ==================== Views ====================

    public Address getAddress() {
        return address;
    }

    public Address getOwner() {
        return owner;
    }

    public long getUnlockBlock() {
        return chain.read(() -> unlockBlock);
    }

    /**
     * Amount deposited by addLiquidity and not yet removed.
     */
    public BigInteger getLockedAmount() {
        return chain.read(() -> lockedAmount);
    }

    /**
     * Currency the lock would pay out on removal.
     */
    public BigInteger getBalance() {
        return network.balanceOf(address);
    }

    public LockState getState() {
        return chain.read(() -> {
            if (unlockBlock == UNSET) {
                return LockState.UNSET;
            }
            return chain.currentBlock() > unlockBlock ? LockState.UNLOCKABLE : LockState.LOCKED;
        });
    }
}
