package com.agrotrace.core.domain;

import net.jqwik.api.*;
import net.jqwik.api.constraints.*;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for practice log entries and their counters.
 */
class PracticeLogEntryPropertyTest {

    /**
     * Property: moderation happens once, and freezes the entry's content.
     */
    @Property(tries = 50)
    void moderatedEntry_isFrozen(
            @ForAll("decisions") ModerationStatus decision,
            @ForAll @AlphaChars @StringLength(min = 1, max = 30) String newDetails) {

        PracticeLogEntry entry = newEntry();
        entry.moderate(decision, "notes", 150);

        assertThatThrownBy(() -> entry.moderate(ModerationStatus.APPROVED, "again", 151))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> entry.revise(newDetails, null))
                .isInstanceOf(IllegalStateException.class);

        assertThat(entry.getModerationStatus()).isEqualTo(decision);
        assertThat(entry.getModerationNotes()).isEqualTo("notes");
        assertThat(entry.getModerationTimestamp()).isEqualTo(150L);
        assertThat(entry.getDetails()).isEqualTo("Planted rye");
    }

    @Test
    void revise_replacesBothFieldsAndNullClearsEvidence() {
        PracticeLogEntry entry = newEntry();

        entry.revise("Planted rye and vetch", null);

        assertThat(entry.getDetails()).isEqualTo("Planted rye and vetch");
        assertThat(entry.getEvidenceHash()).isNull();
        assertThat(entry.isPending()).isTrue();
    }

    @Test
    void pendingIsNotAModerationDecision() {
        PracticeLogEntry entry = newEntry();

        assertThatThrownBy(() -> entry.moderate(ModerationStatus.PENDING, null, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(entry.isPending()).isTrue();
    }

    /**
     * Property: a counter hands out 0, 1, 2, ... in order.
     */
    @Property(tries = 30)
    void counter_isDenseFromZero(@ForAll @IntRange(min = 1, max = 40) int claims) {
        PracticeLogCounter counter = new PracticeLogCounter("farmer-1");

        for (long expected = 0; expected < claims; expected++) {
            assertThat(counter.claimNext()).isEqualTo(expected);
        }
        assertThat(counter.getNextSequence()).isEqualTo((long) claims);
    }

    @Test
    void key_rejectsNegativeSequence() {
        assertThatThrownBy(() -> new PracticeLogKey("farmer-1", -1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new PracticeLogKey("farmer-1", 3)).isEqualTo(new PracticeLogKey("farmer-1", 3));
        assertThat(new PracticeLogKey("farmer-1", 3)).hasToString("farmer-1#3");
    }

    @Provide
    Arbitrary<ModerationStatus> decisions() {
        return Arbitraries.of(ModerationStatus.APPROVED, ModerationStatus.REJECTED);
    }

    private static PracticeLogEntry newEntry() {
        return PracticeLogEntry.create(new PracticeLogKey("farmer-1", 0),
                "Cover Cropping", "Soil Health", "Planted rye", "0xabc", 120);
    }
}
