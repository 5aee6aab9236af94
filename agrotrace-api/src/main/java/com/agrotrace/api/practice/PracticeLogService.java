package com.agrotrace.api.practice;

import com.agrotrace.api.access.AccessControl;
import com.agrotrace.api.access.OperationSequencer;
import com.agrotrace.api.registry.FarmerVerificationSource;
import com.agrotrace.core.domain.ModerationStatus;
import com.agrotrace.core.domain.PracticeLogEntry;
import com.agrotrace.core.domain.PracticeLogKey;
import com.agrotrace.core.domain.PracticeLogSettings;
import com.agrotrace.core.result.OperationResult;
import com.agrotrace.core.result.PracticeLogError;
import com.agrotrace.ledger.clock.LogicalClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Practice Log - append-only record of sustainable-practice claims made by verified farmers,
 * with a single moderator approving or rejecting each claim.
 *
 * Entry state machine: PENDING -> APPROVED | REJECTED (terminal). Details and evidence hash can
 * be revised by the farmer only while the entry is PENDING.
 */
@Service
public class PracticeLogService {

    private static final Logger log = LoggerFactory.getLogger(PracticeLogService.class);

    private final PracticeLogStore store;
    private final FarmerVerificationSource verification;
    private final LogicalClock clock;
    private final OperationSequencer sequencer;

    public PracticeLogService(PracticeLogStore store, FarmerVerificationSource verification,
                              LogicalClock clock, OperationSequencer sequencer) {
        this.store = store;
        this.verification = verification;
        this.clock = clock;
        this.sequencer = sequencer;
    }

    /**
     * Logs a new claim for the caller.
     *
     * @return the sequence number assigned to the entry
     */
    public OperationResult<Long> log(String caller, String practiceType, String category,
                                     String details, String evidenceHash) {
        AccessControl.requireCaller(caller);
        return sequencer.execute("logPractice", () -> {
            if (!verification.isVerified(caller)) {
                return OperationResult.failure(PracticeLogError.NOT_VERIFIED);
            }
            if (isEmpty(practiceType) || isEmpty(category) || isEmpty(details)) {
                return OperationResult.failure(PracticeLogError.INVALID_INPUT);
            }

            long sequence = store.claimSequence(caller);
            PracticeLogKey key = new PracticeLogKey(caller, sequence);
            store.insert(PracticeLogEntry.create(key, practiceType, category, details, evidenceHash,
                    clock.current()));
            sequencer.afterCommit(clock::advance);

            log.info("Farmer {} logged practice #{} ({} / {})", caller, sequence, practiceType, category);
            return OperationResult.ok(sequence);
        });
    }

    /**
     * Moderator decision on a PENDING entry.
     *
     * @param status wire form, {@code "approved"} or {@code "rejected"}
     */
    public OperationResult<Boolean> moderate(String caller, String farmer, long sequence,
                                             String status, String notes) {
        AccessControl.requireCaller(caller);
        return sequencer.execute("moderatePractice", () -> {
            if (!AccessControl.isModerator(store.settings(), caller)) {
                return OperationResult.failure(PracticeLogError.NOT_AUTHORIZED);
            }
            Optional<PracticeLogEntry> found = findEntry(farmer, sequence);
            if (found.isEmpty()) {
                return OperationResult.failure(PracticeLogError.LOG_NOT_FOUND);
            }
            Optional<ModerationStatus> decision = ModerationStatus.fromWire(status)
                    .filter(ModerationStatus::isTerminal);
            if (decision.isEmpty()) {
                return OperationResult.failure(PracticeLogError.INVALID_INPUT);
            }
            PracticeLogEntry entry = found.get();
            if (!entry.isPending()) {
                return OperationResult.failure(PracticeLogError.ALREADY_MODERATED);
            }

            entry.moderate(decision.get(), notes, clock.current());
            store.update(entry);
            sequencer.afterCommit(clock::advance);

            log.info("Practice {} marked {} by moderator {}", entry.getKey(), decision.get().wireValue(), caller);
            return OperationResult.ok(Boolean.TRUE);
        });
    }

    /**
     * Revises one of the caller's own PENDING entries. Details and evidence hash are both
     * replaced as given, empty details included; a null evidence hash clears the stored one.
     */
    public OperationResult<Boolean> update(String caller, long sequence, String details, String evidenceHash) {
        AccessControl.requireCaller(caller);
        return sequencer.execute("updatePractice", () -> {
            Optional<PracticeLogEntry> found = findEntry(caller, sequence);
            if (found.isEmpty()) {
                return OperationResult.failure(PracticeLogError.LOG_NOT_FOUND);
            }
            PracticeLogEntry entry = found.get();
            if (!entry.isPending()) {
                return OperationResult.failure(PracticeLogError.ALREADY_MODERATED);
            }

            entry.revise(details != null ? details : "", evidenceHash);
            store.update(entry);

            log.info("Farmer {} revised practice #{}", caller, sequence);
            return OperationResult.ok(Boolean.TRUE);
        });
    }

    // ==================== Owner Settings ====================

    public OperationResult<Boolean> setModerator(String caller, String moderator) {
        AccessControl.requireCaller(caller);
        return sequencer.execute("setModerator", () -> {
            PracticeLogSettings settings = store.settings();
            if (!AccessControl.isLogOwner(settings, caller)) {
                return OperationResult.failure(PracticeLogError.NOT_AUTHORIZED);
            }
            if (isBlank(moderator)) {
                return OperationResult.failure(PracticeLogError.INVALID_INPUT);
            }
            settings.changeModerator(moderator);
            store.saveSettings(settings);
            log.info("Moderator set to {} by {}", moderator, caller);
            return OperationResult.ok(Boolean.TRUE);
        });
    }

    public OperationResult<Boolean> transferOwnership(String caller, String newOwner) {
        AccessControl.requireCaller(caller);
        return sequencer.execute("transferLogOwnership", () -> {
            PracticeLogSettings settings = store.settings();
            if (!AccessControl.isLogOwner(settings, caller)) {
                return OperationResult.failure(PracticeLogError.NOT_AUTHORIZED);
            }
            if (isBlank(newOwner)) {
                return OperationResult.failure(PracticeLogError.INVALID_INPUT);
            }
            settings.changeOwner(newOwner);
            store.saveSettings(settings);
            log.info("Practice log ownership moved from {} to {}", caller, newOwner);
            return OperationResult.ok(Boolean.TRUE);
        });
    }

    // ==================== Reads ====================

    public Optional<PracticeLogEntryView> getEntry(String farmer, long sequence) {
        return sequencer.read(() -> findEntry(farmer, sequence).map(PracticeLogEntryView::of));
    }

    public long getLogCount(String farmer) {
        return sequencer.read(() -> farmer == null ? 0L : store.logCount(farmer));
    }

    public List<PracticeLogEntryView> listEntries(String farmer) {
        return sequencer.read(() -> farmer == null
                ? List.<PracticeLogEntryView>of()
                : store.findByFarmer(farmer).stream().map(PracticeLogEntryView::of).toList());
    }

    /**
     * Count and entries of one farmer, taken from the same state.
     */
    public FarmerLogView getFarmerLog(String farmer) {
        return sequencer.read(() -> new FarmerLogView(farmer, getLogCount(farmer), listEntries(farmer)));
    }

    public String getOwner() {
        return sequencer.read(() -> store.settings().getOwner());
    }

    public String getModerator() {
        return sequencer.read(() -> store.settings().getModerator());
    }

    public PracticeLogSettingsView getSettings() {
        return sequencer.read(() -> {
            PracticeLogSettings settings = store.settings();
            return new PracticeLogSettingsView(settings.getOwner(), settings.getModerator());
        });
    }

    private Optional<PracticeLogEntry> findEntry(String farmer, long sequence) {
        if (farmer == null || sequence < 0) {
            return Optional.empty();
        }
        return store.find(new PracticeLogKey(farmer, sequence));
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
