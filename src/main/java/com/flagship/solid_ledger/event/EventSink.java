package com.flagship.solid_ledger.event;

import java.util.List;

/**
 * Receives events of committed executions, in emission order.
 *
 * A sink that throws fails the execution, which is then rolled back.
 */
@FunctionalInterface
public interface EventSink {

    void accept(LedgerEvent event);

    /**
     * Receives all events of one execution. Sinks that store events should
     * override this to store the batch all-or-nothing.
     */
    default void acceptAll(List<LedgerEvent> events) {
        for (LedgerEvent event : events) {
            accept(event);
        }
    }
}
