package com.agrotrace.core.repository;

import com.agrotrace.core.domain.FarmerProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for FarmerProfile entities. The primary key is the registry-assigned farmer id,
 * so {@code findById} doubles as the id to principal reverse lookup.
 */
@Repository
public interface FarmerProfileRepository extends JpaRepository<FarmerProfile, Long> {

    Optional<FarmerProfile> findByPrincipal(String principal);

    boolean existsByPrincipal(String principal);

    /**
     * Highest logical timestamp recorded on any profile, or null when the table is empty.
     */
    @Query("SELECT MAX(CASE WHEN f.verificationTimestamp IS NOT NULL AND f.verificationTimestamp > f.registrationTimestamp " +
           "THEN f.verificationTimestamp ELSE f.registrationTimestamp END) FROM FarmerProfile f")
    Long findHighestTimestamp();
}
