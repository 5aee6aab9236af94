package com.agrotrace.core.repository;

import com.agrotrace.core.domain.PracticeLogCounter;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for per-farmer practice log sequence counters.
 */
@Repository
public interface PracticeLogCounterRepository extends JpaRepository<PracticeLogCounter, String> {
}
