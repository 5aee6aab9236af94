package com.agrotrace.api.registry;

import com.agrotrace.core.domain.FarmerProfile;
import com.agrotrace.core.domain.RegistrySettings;
import com.agrotrace.core.repository.FarmerProfileRepository;
import com.agrotrace.core.repository.RegistrySettingsRepository;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Registry store over the Spring Data repositories. Runs inside the caller's transaction.
 */
@Component
public class JpaFarmerRegistryStore implements FarmerRegistryStore {

    private final FarmerProfileRepository profileRepository;
    private final RegistrySettingsRepository settingsRepository;
    private final RegistryProperties properties;

    public JpaFarmerRegistryStore(FarmerProfileRepository profileRepository,
                                  RegistrySettingsRepository settingsRepository,
                                  RegistryProperties properties) {
        this.profileRepository = profileRepository;
        this.settingsRepository = settingsRepository;
        this.properties = properties;
    }

    @Override
    public Optional<FarmerProfile> findByPrincipal(String principal) {
        return profileRepository.findByPrincipal(principal);
    }

    @Override
    public Optional<FarmerProfile> findById(long id) {
        return profileRepository.findById(id);
    }

    @Override
    public boolean existsByPrincipal(String principal) {
        return profileRepository.existsByPrincipal(principal);
    }

    @Override
    public void insert(FarmerProfile profile) {
        profileRepository.save(profile);
    }

    @Override
    public void update(FarmerProfile profile) {
        profileRepository.save(profile);
    }

    @Override
    public RegistrySettings settings() {
        return settingsRepository.findById(RegistrySettings.SINGLETON_ID)
                .orElseGet(() -> settingsRepository.save(RegistrySettings.initial(
                        properties.getOwner(), properties.getVerifier(), properties.getRegistrationFee())));
    }

    @Override
    public void saveSettings(RegistrySettings settings) {
        settingsRepository.save(settings);
    }

    /**
     * Highest logical timestamp stored on any profile, or -1 when there is none.
     */
    public long highestTimestamp() {
        Long highest = profileRepository.findHighestTimestamp();
        return highest != null ? highest : -1;
    }
}
