package com.agrotrace.ledger.clock;

import net.jqwik.api.*;
import net.jqwik.api.constraints.*;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class MonotonicLogicalClockTest {

    @Test
    void startsAtConfiguredValueAndTicksByOne() {
        MonotonicLogicalClock clock = new MonotonicLogicalClock(100);

        assertThat(clock.current()).isEqualTo(100);
        assertThat(clock.advance()).isEqualTo(101);
        assertThat(clock.current()).isEqualTo(101);
    }

    @Test
    void negativeStart_isRefused() {
        assertThatThrownBy(() -> new MonotonicLogicalClock(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Property: advancePast never moves the clock backwards, and always ends past the observed value.
     */
    @Property(tries = 100)
    void advancePast_neverGoesBackwards(
            @ForAll @LongRange(min = 0, max = 10_000) long start,
            @ForAll @LongRange(min = -1, max = 10_000) long observed) {

        MonotonicLogicalClock clock = new MonotonicLogicalClock(start);
        clock.advancePast(observed);

        assertThat(clock.current()).isGreaterThanOrEqualTo(start);
        assertThat(clock.current()).isGreaterThan(observed);
    }
}
