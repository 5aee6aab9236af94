package com.agrotrace.api.practice;

import com.agrotrace.api.InMemoryPlatform;
import com.agrotrace.api.access.OperationSequencer;
import com.agrotrace.api.registry.FarmerProfileView;
import com.agrotrace.core.domain.ModerationStatus;
import com.agrotrace.core.domain.VerificationStatus;
import com.agrotrace.core.result.OperationResult;
import com.agrotrace.core.result.PracticeLogError;
import com.agrotrace.ledger.clock.MonotonicLogicalClock;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionOperations;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.LongStream;

import static com.agrotrace.api.InMemoryPlatform.*;
import static org.assertj.core.api.Assertions.*;

class PracticeLogServiceTest {

    private InMemoryPlatform platform;
    private PracticeLogService practiceLog;

    @BeforeEach
    void setUp() {
        platform = new InMemoryPlatform().fund("alice", 1).fund("bob", 1);
        practiceLog = platform.practiceLog;
    }

    // ==================== Logging ====================

    @Test
    void log_byUnverifiedCaller_failsNotVerified() {
        assertThat(practiceLog.log("ghost", "Cover Cropping", "Soil Health", "Planted rye", null).error())
                .contains(PracticeLogError.NOT_VERIFIED);

        platform.registry.register("alice", "John Doe", "Rural Area", 100, null);
        assertThat(practiceLog.log("alice", "Cover Cropping", "Soil Health", "Planted rye", null).errorCode())
                .isEqualTo(202);

        platform.registry.verify(VERIFIER, "alice", "rejected");
        assertThat(practiceLog.log("alice", "Cover Cropping", "Soil Health", "Planted rye", null).errorCode())
                .isEqualTo(202);
        assertThat(practiceLog.getLogCount("alice")).isZero();
    }

    @Test
    void log_rejectsEmptyFieldsWithoutConsumingASequence() {
        platform.onboard("alice");

        assertThat(practiceLog.log("alice", "", "Soil Health", "Planted rye", null).error())
                .contains(PracticeLogError.INVALID_INPUT);
        assertThat(practiceLog.log("alice", "Cover Cropping", "", "Planted rye", null).error())
                .contains(PracticeLogError.INVALID_INPUT);
        assertThat(practiceLog.log("alice", "Cover Cropping", "Soil Health", "", null).error())
                .contains(PracticeLogError.INVALID_INPUT);

        assertThat(practiceLog.getLogCount("alice")).isZero();
        assertThat(practiceLog.log("alice", "Cover Cropping", "Soil Health", "Planted rye", null).value()).isZero();
    }

    @Test
    void sequences_arePerFarmer() {
        platform.onboard("alice");
        platform.onboard("bob");

        assertThat(practiceLog.log("alice", "A", "C", "d1", null).value()).isEqualTo(0L);
        assertThat(practiceLog.log("bob", "A", "C", "d1", null).value()).isEqualTo(0L);
        assertThat(practiceLog.log("alice", "A", "C", "d2", null).value()).isEqualTo(1L);

        assertThat(practiceLog.getLogCount("alice")).isEqualTo(2);
        assertThat(practiceLog.getLogCount("bob")).isEqualTo(1);
        assertThat(practiceLog.getLogCount("nobody")).isZero();
        assertThat(practiceLog.listEntries("alice"))
                .extracting(PracticeLogEntryView::details)
                .containsExactly("d1", "d2");
    }

    @Test
    void deactivatedFarmer_canStillLog() {
        platform.onboard("alice");
        platform.registry.deactivate(OWNER, "alice");

        assertThat(practiceLog.log("alice", "Mulching", "Water", "Straw mulch", null).value()).isZero();
    }

    @Test
    void farmerLog_reportsCountAndEntriesTogether() {
        platform.onboard("alice");
        practiceLog.log("alice", "Cover Cropping", "Soil Health", "Planted rye", null);
        practiceLog.log("alice", "Mulching", "Water", "Straw mulch", "0x1");

        FarmerLogView farmerLog = practiceLog.getFarmerLog("alice");

        assertThat(farmerLog.farmer()).isEqualTo("alice");
        assertThat(farmerLog.count()).isEqualTo(2);
        assertThat(farmerLog.entries()).hasSize(2)
                .extracting(PracticeLogEntryView::sequenceNumber)
                .containsExactly(0L, 1L);
        assertThat(practiceLog.getFarmerLog("nobody")).isEqualTo(new FarmerLogView("nobody", 0, List.of()));
    }

    @Test
    void log_acceptsLongDetails() {
        platform.onboard("alice");
        String details = "d".repeat(10_000);

        assertThat(practiceLog.log("alice", "Cover Cropping", "Soil Health", details, "e".repeat(600)).value()).isZero();
        assertThat(practiceLog.getEntry("alice", 0).orElseThrow().details()).isEqualTo(details);
    }

    // ==================== Moderation ====================

    @Test
    void moderate_guardsInOrder() {
        platform.onboard("alice");
        practiceLog.log("alice", "Cover Cropping", "Soil Health", "Planted rye", "0xabc");

        assertThat(practiceLog.moderate("alice", "alice", 0, "approved", null).errorCode()).isEqualTo(200);
        assertThat(practiceLog.moderate(OWNER, "alice", 0, "approved", null).errorCode()).isEqualTo(200);
        assertThat(practiceLog.moderate(MODERATOR, "alice", 1, "approved", null).errorCode()).isEqualTo(204);
        assertThat(practiceLog.moderate(MODERATOR, "bob", 0, "approved", null).errorCode()).isEqualTo(204);
        assertThat(practiceLog.moderate(MODERATOR, "alice", 0, "pending", null).errorCode()).isEqualTo(203);
        assertThat(practiceLog.moderate(MODERATOR, "alice", 0, "maybe", null).errorCode()).isEqualTo(203);

        assertThat(practiceLog.getEntry("alice", 0).orElseThrow().moderationStatus()).isEqualTo(ModerationStatus.PENDING);
    }

    @Test
    void moderateTwice_secondFailsAlreadyModerated() {
        platform.onboard("alice");
        practiceLog.log("alice", "Cover Cropping", "Soil Health", "Planted rye", null);

        assertThat(practiceLog.moderate(MODERATOR, "alice", 0, "rejected", "No evidence").value()).isTrue();
        assertThat(practiceLog.moderate(MODERATOR, "alice", 0, "approved", "Changed my mind").errorCode()).isEqualTo(205);

        PracticeLogEntryView entry = practiceLog.getEntry("alice", 0).orElseThrow();
        assertThat(entry.moderationStatus()).isEqualTo(ModerationStatus.REJECTED);
        assertThat(entry.moderationNotes()).isEqualTo("No evidence");
    }

    // ==================== Updates ====================

    @Test
    void update_beforeModeration_replacesDetailsAndEvidence() {
        platform.onboard("alice");
        practiceLog.log("alice", "Cover Cropping", "Soil Health", "Planted rye", "0xabc");

        assertThat(practiceLog.update("alice", 0, "Planted rye and clover", null).value()).isTrue();

        PracticeLogEntryView entry = practiceLog.getEntry("alice", 0).orElseThrow();
        assertThat(entry.details()).isEqualTo("Planted rye and clover");
        assertThat(entry.evidenceHash()).isNull();
        assertThat(entry.practiceType()).isEqualTo("Cover Cropping");
    }

    @Test
    void update_afterModeration_failsAlreadyModerated() {
        platform.onboard("alice");
        practiceLog.log("alice", "Cover Cropping", "Soil Health", "Planted rye", "0xabc");
        practiceLog.moderate(MODERATOR, "alice", 0, "approved", null);

        assertThat(practiceLog.update("alice", 0, "Edited", "0xdef").errorCode()).isEqualTo(205);
        assertThat(practiceLog.getEntry("alice", 0).orElseThrow().details()).isEqualTo("Planted rye");
    }

    @Test
    void update_onlyReachesTheCallersOwnEntries() {
        platform.onboard("alice");
        practiceLog.log("alice", "Cover Cropping", "Soil Health", "Planted rye", null);

        assertThat(practiceLog.update("bob", 0, "Hijacked", null).errorCode()).isEqualTo(204);
        assertThat(practiceLog.update("alice", 7, "Nope", null).errorCode()).isEqualTo(204);
        assertThat(practiceLog.getEntry("alice", 0).orElseThrow().details()).isEqualTo("Planted rye");
    }

    @Test
    void update_overwritesWithEmptyDetails() {
        platform.onboard("alice");
        practiceLog.log("alice", "Cover Cropping", "Soil Health", "Planted rye", null);

        assertThat(practiceLog.update("alice", 0, "", "h").value()).isTrue();

        PracticeLogEntryView entry = practiceLog.getEntry("alice", 0).orElseThrow();
        assertThat(entry.details()).isEmpty();
        assertThat(entry.evidenceHash()).isEqualTo("h");
        assertThat(entry.moderationStatus()).isEqualTo(ModerationStatus.PENDING);
    }

    @Test
    void update_leavesTheClockAlone() {
        platform.onboard("alice");
        practiceLog.log("alice", "Cover Cropping", "Soil Health", "Planted rye", null);
        long before = platform.clock.current();

        practiceLog.update("alice", 0, "Planted rye and clover", null);

        assertThat(platform.clock.current()).isEqualTo(before);
    }

    // ==================== Owner Settings ====================

    @Test
    void setModerator_handsOverModeration() {
        platform.onboard("alice");
        practiceLog.log("alice", "Cover Cropping", "Soil Health", "Planted rye", null);

        assertThat(practiceLog.setModerator(MODERATOR, "x").errorCode()).isEqualTo(200);
        assertThat(practiceLog.setModerator(OWNER, "").errorCode()).isEqualTo(203);
        assertThat(practiceLog.setModerator(OWNER, "new-moderator").value()).isTrue();

        assertThat(practiceLog.moderate(MODERATOR, "alice", 0, "approved", null).errorCode()).isEqualTo(200);
        assertThat(practiceLog.moderate("new-moderator", "alice", 0, "approved", null).value()).isTrue();
    }

    @Test
    void transferOwnership_isOwnerOnly() {
        assertThat(practiceLog.transferOwnership("alice", "alice").errorCode()).isEqualTo(200);
        assertThat(practiceLog.transferOwnership(OWNER, "new-owner").value()).isTrue();

        assertThat(practiceLog.getOwner()).isEqualTo("new-owner");
        assertThat(practiceLog.getSettings()).isEqualTo(new PracticeLogSettingsView("new-owner", MODERATOR));
        assertThat(practiceLog.setModerator(OWNER, "x").errorCode()).isEqualTo(200);
    }

    // ==================== End to End ====================

    @Test
    void fullScenario_registerVerifyLogModerate() {
        assertThat(platform.registry.register("alice", "John Doe", "Rural Area", 100, "Organic farm").value()).isEqualTo(1L);
        assertThat(platform.registry.verify(VERIFIER, "alice", "verified").value()).isTrue();

        FarmerProfileView profile = platform.registry.getProfile("alice").orElseThrow();
        assertThat(profile.verificationStatus()).isEqualTo(VerificationStatus.VERIFIED);
        assertThat(profile.verificationStatus().wireValue()).isEqualTo("verified");

        assertThat(practiceLog.log("alice", "Cover Cropping", "Soil Health", "Planted rye", null).value()).isZero();
        assertThat(practiceLog.moderate(MODERATOR, "alice", 0, "approved", "Good practice").value()).isTrue();

        PracticeLogEntryView entry = practiceLog.getEntry("alice", 0).orElseThrow();
        assertThat(entry.moderationStatus().wireValue()).isEqualTo("approved");
        assertThat(entry.moderationNotes()).isEqualTo("Good practice");
        assertThat(entry.timestamp()).isEqualTo(102);
        assertThat(entry.moderationTimestamp()).isEqualTo(103L);
        assertThat(platform.clock.current()).isEqualTo(104);
    }

    // ==================== Properties ====================

    /**
     * Property: sequence numbers of a farmer are exactly 0..n-1, whatever fails in between.
     */
    @Property(tries = 30)
    void sequences_areDenseDespiteRejectedCalls(
            @ForAll @Size(min = 1, max = 25) List<Boolean> validCalls) {

        Set<String> verified = new HashSet<>(Set.of("alice"));
        OperationSequencer sequencer = new OperationSequencer(TransactionOperations.withoutTransaction());
        PracticeLogService service = new PracticeLogService(
                new InMemoryPracticeLogStore(OWNER, MODERATOR), verified::contains,
                new MonotonicLogicalClock(0), sequencer);

        long expected = 0;
        for (boolean valid : validCalls) {
            String details = valid ? "details" : "";
            OperationResult<Long> result = service.log("alice", "Type", "Category", details, null);
            if (valid) {
                assertThat(result.value()).isEqualTo(expected++);
            } else {
                assertThat(result.errorCode()).isEqualTo(203);
            }
        }

        assertThat(service.getLogCount("alice")).isEqualTo(expected);
        assertThat(service.listEntries("alice"))
                .extracting(PracticeLogEntryView::sequenceNumber)
                .containsExactlyElementsOf(LongStream.range(0, expected).boxed().toList());
    }
}
