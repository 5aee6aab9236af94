package com.agrotrace.ledger.clock;

/**
 * Monotonic logical clock supplied by the hosting environment, used in place of wall time.
 */
public interface LogicalClock {

    /**
     * Current clock value. Never lower than any value returned before.
     */
    long current();

    /**
     * Marks the end of a state-changing operation and returns the new current value.
     */
    long advance();
}
