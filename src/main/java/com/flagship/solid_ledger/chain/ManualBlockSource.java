package com.flagship.solid_ledger.chain;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Block source advanced explicitly by the caller.
 */
public class ManualBlockSource implements BlockSource {

    private final AtomicLong block;

    public ManualBlockSource() {
        this(1L);
    }

    public ManualBlockSource(long startBlock) {
        if (startBlock < 0) {
            throw new IllegalArgumentException("Block number cannot be negative: " + startBlock);
        }
        this.block = new AtomicLong(startBlock);
    }

    @Override
    public long currentBlock() {
        return block.get();
    }

    /**
     * Moves to the next block.
     *
     * @return the new block number
     */
    public long advance() {
        return block.incrementAndGet();
    }

    public long advance(long blocks) {
        if (blocks < 0) {
            throw new IllegalArgumentException("Cannot move blocks backwards: " + blocks);
        }
        return block.addAndGet(blocks);
    }

    public void advanceTo(long target) {
        long current = block.get();
        if (target < current) {
            throw new IllegalArgumentException(
                String.format("Cannot move from block %d back to %d", current, target));
        }
        block.set(target);
    }
}
