package com.agrotrace.api.practice;

import com.agrotrace.core.domain.PracticeLogEntry;
import com.agrotrace.core.domain.PracticeLogKey;
import com.agrotrace.core.domain.PracticeLogSettings;

import java.util.List;
import java.util.Optional;

/**
 * Storage for practice log entries, their per-farmer counters and the log settings record.
 * Entries are never deleted.
 */
public interface PracticeLogStore {

    Optional<PracticeLogEntry> find(PracticeLogKey key);

    void insert(PracticeLogEntry entry);

    void update(PracticeLogEntry entry);

    /**
     * Number of entries ever logged by the farmer, which is also its next sequence number.
     */
    long logCount(String farmer);

    /**
     * Hands out the farmer's next sequence number and advances its counter.
     */
    long claimSequence(String farmer);

    /**
     * All entries of one farmer in ascending sequence order.
     */
    List<PracticeLogEntry> findByFarmer(String farmer);

    PracticeLogSettings settings();

    void saveSettings(PracticeLogSettings settings);
}
