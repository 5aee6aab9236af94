package com.agrotrace.api.practice;

import com.agrotrace.core.domain.ModerationStatus;
import com.agrotrace.core.domain.PracticeLogEntry;

/**
 * Immutable snapshot of a practice log entry.
 */
public record PracticeLogEntryView(
        String farmer,
        long sequenceNumber,
        String practiceType,
        String category,
        long timestamp,
        String details,
        String evidenceHash,
        ModerationStatus moderationStatus,
        String moderationNotes,
        Long moderationTimestamp
) {

    public static PracticeLogEntryView of(PracticeLogEntry entry) {
        return new PracticeLogEntryView(
                entry.getFarmer(),
                entry.getSequenceNumber(),
                entry.getPracticeType(),
                entry.getCategory(),
                entry.getTimestamp(),
                entry.getDetails(),
                entry.getEvidenceHash(),
                entry.getModerationStatus(),
                entry.getModerationNotes(),
                entry.getModerationTimestamp());
    }
}
