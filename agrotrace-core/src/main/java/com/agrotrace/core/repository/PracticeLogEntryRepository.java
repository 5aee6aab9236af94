package com.agrotrace.core.repository;

import com.agrotrace.core.domain.PracticeLogEntry;
import com.agrotrace.core.domain.PracticeLogKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for PracticeLogEntry entities keyed by (farmer, sequence number).
 */
@Repository
public interface PracticeLogEntryRepository extends JpaRepository<PracticeLogEntry, PracticeLogKey> {

    @Query("SELECT e FROM PracticeLogEntry e WHERE e.key.farmer = :farmer ORDER BY e.key.sequenceNumber ASC")
    List<PracticeLogEntry> findByFarmerOrdered(@Param("farmer") String farmer);

    /**
     * Highest logical timestamp recorded on any entry, or null when the table is empty.
     */
    @Query("SELECT MAX(CASE WHEN e.moderationTimestamp IS NOT NULL AND e.moderationTimestamp > e.timestamp " +
           "THEN e.moderationTimestamp ELSE e.timestamp END) FROM PracticeLogEntry e")
    Long findHighestTimestamp();
}
