package com.agrotrace.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

/**
 * PracticeLogEntry - One sustainable-practice claim made by a verified farmer.
 *
 * Entries are append-only. Content (details, evidence hash) may change only while the entry
 * is PENDING; moderation moves it once to APPROVED or REJECTED.
 */
@Entity
@Table(name = "practice_log_entries", indexes = {
    @Index(name = "idx_practice_moderation_status", columnList = "moderation_status")
})
public class PracticeLogEntry {

    @EmbeddedId
    private PracticeLogKey key;

    @NotEmpty
    @Column(name = "practice_type", nullable = false, updatable = false)
    private String practiceType;

    @NotEmpty
    @Column(name = "category", nullable = false, updatable = false)
    private String category;

    @Column(name = "logged_at", nullable = false, updatable = false)
    private long timestamp;

    @NotNull
    @Column(name = "details", nullable = false)
    private String details;

    @Column(name = "evidence_hash")
    private String evidenceHash;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "moderation_status", nullable = false)
    private ModerationStatus moderationStatus;

    @Column(name = "moderation_notes")
    private String moderationNotes;

    @Column(name = "moderation_timestamp")
    private Long moderationTimestamp;

    protected PracticeLogEntry() {}

    /**
     * Creates a new PENDING entry.
     */
    public static PracticeLogEntry create(PracticeLogKey key, String practiceType, String category,
                                          String details, String evidenceHash, long loggedAt) {
        PracticeLogEntry entry = new PracticeLogEntry();
        entry.key = key;
        entry.practiceType = practiceType;
        entry.category = category;
        entry.details = details;
        entry.evidenceHash = evidenceHash;
        entry.timestamp = loggedAt;
        entry.moderationStatus = ModerationStatus.PENDING;
        return entry;
    }

    /**
     * Replaces details and evidence hash. Empty details are kept as given; a null evidence hash
     * clears it.
     */
    public void revise(String details, String evidenceHash) {
        requirePending();
        this.details = details;
        this.evidenceHash = evidenceHash;
    }

    public void moderate(ModerationStatus decision, String notes, long moderatedAt) {
        if (decision == null || !decision.isTerminal()) {
            throw new IllegalArgumentException("Decision must be APPROVED or REJECTED");
        }
        requirePending();
        this.moderationStatus = decision;
        this.moderationNotes = notes;
        this.moderationTimestamp = moderatedAt;
    }

    public boolean isPending() {
        return moderationStatus == ModerationStatus.PENDING;
    }

    private void requirePending() {
        if (moderationStatus != ModerationStatus.PENDING) {
            throw new IllegalStateException("Entry " + key + " already moderated");
        }
    }

    // Getters
    public PracticeLogKey getKey() { return key; }
    public String getFarmer() { return key.getFarmer(); }
    public long getSequenceNumber() { return key.getSequenceNumber(); }
    public String getPracticeType() { return practiceType; }
    public String getCategory() { return category; }
    public long getTimestamp() { return timestamp; }
    public String getDetails() { return details; }
    public String getEvidenceHash() { return evidenceHash; }
    public ModerationStatus getModerationStatus() { return moderationStatus; }
    public String getModerationNotes() { return moderationNotes; }
    public Long getModerationTimestamp() { return moderationTimestamp; }
}
