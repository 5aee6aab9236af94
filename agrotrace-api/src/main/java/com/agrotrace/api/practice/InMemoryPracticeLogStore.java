package com.agrotrace.api.practice;

import com.agrotrace.core.domain.PracticeLogCounter;
import com.agrotrace.core.domain.PracticeLogEntry;
import com.agrotrace.core.domain.PracticeLogKey;
import com.agrotrace.core.domain.PracticeLogSettings;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Map-backed practice log store for embedded use and tests.
 */
public class InMemoryPracticeLogStore implements PracticeLogStore {

    private final Map<PracticeLogKey, PracticeLogEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, PracticeLogCounter> counters = new ConcurrentHashMap<>();
    private final PracticeLogSettings settings;

    public InMemoryPracticeLogStore(String owner, String moderator) {
        this.settings = PracticeLogSettings.initial(owner, moderator);
    }

    @Override
    public Optional<PracticeLogEntry> find(PracticeLogKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void insert(PracticeLogEntry entry) {
        if (entries.putIfAbsent(entry.getKey(), entry) != null) {
            throw new IllegalStateException("Entry already stored: " + entry.getKey());
        }
    }

    @Override
    public void update(PracticeLogEntry entry) {
        if (!entries.containsKey(entry.getKey())) {
            throw new IllegalStateException("No stored entry " + entry.getKey());
        }
        entries.put(entry.getKey(), entry);
    }

    @Override
    public long logCount(String farmer) {
        PracticeLogCounter counter = counters.get(farmer);
        return counter != null ? counter.getNextSequence() : 0;
    }

    @Override
    public long claimSequence(String farmer) {
        return counters.computeIfAbsent(farmer, PracticeLogCounter::new).claimNext();
    }

    @Override
    public List<PracticeLogEntry> findByFarmer(String farmer) {
        return entries.values().stream()
                .filter(entry -> entry.getFarmer().equals(farmer))
                .sorted(Comparator.comparingLong(PracticeLogEntry::getSequenceNumber))
                .collect(Collectors.toList());
    }

    @Override
    public PracticeLogSettings settings() {
        return settings;
    }

    @Override
    public void saveSettings(PracticeLogSettings settings) {
        if (settings != this.settings) {
            throw new IllegalArgumentException("Foreign settings record");
        }
    }
}
