package com.agrotrace.core.repository;

import com.agrotrace.core.domain.RegistrySettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RegistrySettingsRepository extends JpaRepository<RegistrySettings, Long> {
}
