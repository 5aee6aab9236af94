package com.agrotrace.core.repository;

import com.agrotrace.core.domain.PracticeLogSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PracticeLogSettingsRepository extends JpaRepository<PracticeLogSettings, Long> {
}
