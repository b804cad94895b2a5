package com.flagship.solid_ledger.chain;

import com.flagship.solid_ledger.event.EventSink;
import com.flagship.solid_ledger.event.LedgerEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serialized execution context shared by every contract.
 *
 * Key properties:
 * - One global lock: entry points never interleave across threads
 * - Undo journal with savepoints: a failed frame reverts every change it recorded
 * - Nested frames roll back on their own, so a caught reentrant failure leaves no trace
 * - Events are released to sinks when the outermost frame commits; a sink failure
 *   rolls the execution back
 *
 * The lock is re-entrant because a recipient hook runs on the calling thread
 * and may call back into a contract while the outer frame is still open.
 */
@Slf4j
public class Chain {

    private final ReentrantLock lock = new ReentrantLock();
    private final BlockSource blockSource;
    private final List<EventSink> sinks = new CopyOnWriteArrayList<>();

    // Guarded by lock
    private final List<Runnable> undoLog = new ArrayList<>();
    private final List<LedgerEvent> pendingEvents = new ArrayList<>();
    private int depth;
    private long executionSequence;
    private long currentExecution;
    private long executionBlock;

    public Chain(BlockSource blockSource) {
        this.blockSource = blockSource;
    }

    public void registerSink(EventSink sink) {
        sinks.add(sink);
    }

    /**
     * Runs the body as one atomic frame.
     *
     * If the body throws, every change journaled since the frame opened is undone
     * in reverse order and the exception propagates unchanged.
     */
    public <T> T execute(Supplier<T> body) {
        lock.lock();
        try {
            boolean outermost = depth == 0;
            if (outermost) {
                currentExecution = ++executionSequence;
                executionBlock = blockSource.currentBlock();
            }
            int savepoint = undoLog.size();
            depth++;
            T result;
            try {
                result = body.get();
            } catch (RuntimeException | Error e) {
                depth--;
                rollbackTo(savepoint);
                throw e;
            }
            depth--;
            if (outermost) {
                commit();
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs the body as one atomic frame and reports the block it executed in.
     */
    public <T> Receipt<T> submit(Supplier<T> body) {
        return execute(() -> new Receipt<>(body.get(), currentBlock()));
    }

    public void run(Runnable body) {
        execute(() -> {
            body.run();
            return null;
        });
    }

    /**
     * Runs a read-only view under the global lock without opening a frame.
     */
    public <T> T read(Supplier<T> view) {
        lock.lock();
        try {
            return view.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records how to revert a state change made in the current frame.
     */
    public void journal(Runnable undo) {
        requireExecution();
        undoLog.add(undo);
    }

    /**
     * Emits an event; it is discarded if the enclosing frame rolls back.
     */
    public void emit(LedgerEvent event) {
        requireExecution();
        pendingEvents.add(event);
        undoLog.add(() -> pendingEvents.remove(pendingEvents.size() - 1));
    }

    /**
     * Block number of the running execution, stable for its whole duration.
     * Outside an execution this is the live block.
     */
    public long currentBlock() {
        lock.lock();
        try {
            return depth > 0 ? executionBlock : blockSource.currentBlock();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Identifier of the running top-level execution.
     */
    public long executionId() {
        requireExecution();
        return currentExecution;
    }

    public boolean isExecuting() {
        return lock.isHeldByCurrentThread() && depth > 0;
    }

    private void requireExecution() {
        if (!isExecuting()) {
            throw new IllegalStateException("State can only change inside Chain.execute");
        }
    }

    private void rollbackTo(int savepoint) {
        for (int i = undoLog.size() - 1; i >= savepoint; i--) {
            undoLog.remove(i).run();
        }
    }

    private void commit() {
        List<LedgerEvent> committed = List.copyOf(pendingEvents);
        // Delivered under the lock so sinks observe commit order. The undo log is
        // still intact here, so a failing sink reverts the whole execution.
        try {
            if (!committed.isEmpty()) {
                for (EventSink sink : sinks) {
                    sink.acceptAll(committed);
                }
            }
        } catch (RuntimeException | Error e) {
            log.error("Event delivery failed, rolling back execution {}", currentExecution, e);
            rollbackTo(0);
            pendingEvents.clear();
            throw e;
        }
        pendingEvents.clear();
        undoLog.clear();
        if (!committed.isEmpty()) {
            log.debug("Execution {} committed with {} events", currentExecution, committed.size());
        }
    }
}
