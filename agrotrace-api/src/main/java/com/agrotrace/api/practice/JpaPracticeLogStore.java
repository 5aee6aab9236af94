package com.agrotrace.api.practice;

import com.agrotrace.core.domain.PracticeLogCounter;
import com.agrotrace.core.domain.PracticeLogEntry;
import com.agrotrace.core.domain.PracticeLogKey;
import com.agrotrace.core.domain.PracticeLogSettings;
import com.agrotrace.core.repository.PracticeLogCounterRepository;
import com.agrotrace.core.repository.PracticeLogEntryRepository;
import com.agrotrace.core.repository.PracticeLogSettingsRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Practice log store over the Spring Data repositories. Runs inside the caller's transaction.
 */
@Component
public class JpaPracticeLogStore implements PracticeLogStore {

    private final PracticeLogEntryRepository entryRepository;
    private final PracticeLogCounterRepository counterRepository;
    private final PracticeLogSettingsRepository settingsRepository;
    private final PracticeLogProperties properties;

    public JpaPracticeLogStore(PracticeLogEntryRepository entryRepository,
                               PracticeLogCounterRepository counterRepository,
                               PracticeLogSettingsRepository settingsRepository,
                               PracticeLogProperties properties) {
        this.entryRepository = entryRepository;
        this.counterRepository = counterRepository;
        this.settingsRepository = settingsRepository;
        this.properties = properties;
    }

    @Override
    public Optional<PracticeLogEntry> find(PracticeLogKey key) {
        return entryRepository.findById(key);
    }

    @Override
    public void insert(PracticeLogEntry entry) {
        entryRepository.save(entry);
    }

    @Override
    public void update(PracticeLogEntry entry) {
        entryRepository.save(entry);
    }

    @Override
    public long logCount(String farmer) {
        return counterRepository.findById(farmer)
                .map(PracticeLogCounter::getNextSequence)
                .orElse(0L);
    }

    @Override
    public long claimSequence(String farmer) {
        PracticeLogCounter counter = counterRepository.findById(farmer)
                .orElseGet(() -> new PracticeLogCounter(farmer));
        long sequence = counter.claimNext();
        counterRepository.save(counter);
        return sequence;
    }

    @Override
    public List<PracticeLogEntry> findByFarmer(String farmer) {
        return entryRepository.findByFarmerOrdered(farmer);
    }

    @Override
    public PracticeLogSettings settings() {
        return settingsRepository.findById(PracticeLogSettings.SINGLETON_ID)
                .orElseGet(() -> settingsRepository.save(PracticeLogSettings.initial(
                        properties.getOwner(), properties.getModerator())));
    }

    @Override
    public void saveSettings(PracticeLogSettings settings) {
        settingsRepository.save(settings);
    }

    /**
     * Highest logical timestamp stored on any entry, or -1 when there is none.
     */
    public long highestTimestamp() {
        Long highest = entryRepository.findHighestTimestamp();
        return highest != null ? highest : -1;
    }
}
