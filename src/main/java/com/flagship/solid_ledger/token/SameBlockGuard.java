package com.flagship.solid_ledger.token;

import com.flagship.solid_ledger.chain.Address;
import com.flagship.solid_ledger.chain.Chain;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Rejects a second ledger mutation by the same caller within one block.
 *
 * The guard is keyed on the caller of the entry point, not on the account whose
 * units move. Moves made inside one execution count as a single mutation, and an
 * account that never mutated is never rejected.
 */
@Slf4j
public class SameBlockGuard {

    private final Chain chain;
    private final Map<Address, Mark> lastMutation = new HashMap<>();

    public SameBlockGuard(Chain chain) {
        this.chain = chain;
    }

    /**
     * Records a mutation by the caller in the current block.
     *
     * @throws LedgerException SAME_BLOCK_REPLAY if the caller already mutated in this
     *                         block during another execution
     */
    public void check(Address caller) {
        long block = chain.currentBlock();
        long execution = chain.executionId();
        Mark previous = lastMutation.get(caller);

        if (previous != null && previous.block == block) {
            if (previous.execution == execution) {
                return;
            }
            log.warn("Same-block replay rejected: caller={}, block={}", caller, block);
            throw new LedgerException(ErrorCode.SAME_BLOCK_REPLAY,
                String.format("Account %s already mutated the ledger in block %d", caller, block));
        }

        lastMutation.put(caller, new Mark(block, execution));
        chain.journal(() -> {
            if (previous == null) {
                lastMutation.remove(caller);
            } else {
                lastMutation.put(caller, previous);
            }
        });
    }

    public OptionalLong lastMutationBlock(Address account) {
        return chain.read(() -> {
            Mark mark = lastMutation.get(account);
            return mark == null ? OptionalLong.empty() : OptionalLong.of(mark.block);
        });
    }

    private record Mark(long block, long execution) {}
}
