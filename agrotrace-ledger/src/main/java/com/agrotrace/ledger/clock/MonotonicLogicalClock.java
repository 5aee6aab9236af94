package com.agrotrace.ledger.clock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counter clock that ticks once per completed state-changing operation.
 */
public class MonotonicLogicalClock implements LogicalClock {

    private final AtomicLong value;

    public MonotonicLogicalClock(long start) {
        if (start < 0) {
            throw new IllegalArgumentException("Clock start cannot be negative");
        }
        this.value = new AtomicLong(start);
    }

    @Override
    public long current() {
        return value.get();
    }

    @Override
    public long advance() {
        return value.incrementAndGet();
    }

    /**
     * Moves the clock strictly past {@code observed} if it is not already there.
     * Used at startup so timestamps keep increasing across restarts.
     */
    public void advancePast(long observed) {
        value.accumulateAndGet(observed + 1, Math::max);
    }
}
