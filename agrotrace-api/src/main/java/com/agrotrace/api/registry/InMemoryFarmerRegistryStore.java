package com.agrotrace.api.registry;

import com.agrotrace.core.domain.FarmerProfile;
import com.agrotrace.core.domain.RegistrySettings;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed registry store for embedded use and tests.
 */
public class InMemoryFarmerRegistryStore implements FarmerRegistryStore {

    private final Map<String, FarmerProfile> byPrincipal = new ConcurrentHashMap<>();
    private final Map<Long, String> principalById = new ConcurrentHashMap<>();
    private final RegistrySettings settings;

    public InMemoryFarmerRegistryStore(String owner, String verifier, BigInteger registrationFee) {
        this.settings = RegistrySettings.initial(owner, verifier, registrationFee);
    }

    @Override
    public Optional<FarmerProfile> findByPrincipal(String principal) {
        return Optional.ofNullable(byPrincipal.get(principal));
    }

    @Override
    public Optional<FarmerProfile> findById(long id) {
        return Optional.ofNullable(principalById.get(id)).map(byPrincipal::get);
    }

    @Override
    public boolean existsByPrincipal(String principal) {
        return byPrincipal.containsKey(principal);
    }

    @Override
    public void insert(FarmerProfile profile) {
        if (byPrincipal.putIfAbsent(profile.getPrincipal(), profile) != null) {
            throw new IllegalStateException("Profile already stored for " + profile.getPrincipal());
        }
        principalById.put(profile.getId(), profile.getPrincipal());
    }

    @Override
    public void update(FarmerProfile profile) {
        if (!byPrincipal.containsKey(profile.getPrincipal())) {
            throw new IllegalStateException("No stored profile for " + profile.getPrincipal());
        }
        byPrincipal.put(profile.getPrincipal(), profile);
    }

    @Override
    public RegistrySettings settings() {
        return settings;
    }

    @Override
    public void saveSettings(RegistrySettings settings) {
        if (settings != this.settings) {
            throw new IllegalArgumentException("Foreign settings record");
        }
    }
}
