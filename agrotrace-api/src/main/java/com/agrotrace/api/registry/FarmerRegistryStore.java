package com.agrotrace.api.registry;

import com.agrotrace.core.domain.FarmerProfile;
import com.agrotrace.core.domain.RegistrySettings;

import java.util.Optional;

/**
 * Key-indexed storage for farmer profiles and the registry settings record.
 * There is deliberately no delete: profiles live forever.
 */
public interface FarmerRegistryStore {

    Optional<FarmerProfile> findByPrincipal(String principal);

    /**
     * Reverse lookup from farmer id.
     */
    Optional<FarmerProfile> findById(long id);

    boolean existsByPrincipal(String principal);

    void insert(FarmerProfile profile);

    void update(FarmerProfile profile);

    RegistrySettings settings();

    void saveSettings(RegistrySettings settings);
}
