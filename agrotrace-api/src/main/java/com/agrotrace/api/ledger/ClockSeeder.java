package com.agrotrace.api.ledger;

import com.agrotrace.api.practice.JpaPracticeLogStore;
import com.agrotrace.api.registry.JpaFarmerRegistryStore;
import com.agrotrace.ledger.clock.LogicalClock;
import com.agrotrace.ledger.clock.MonotonicLogicalClock;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Moves a local counter clock past every timestamp already stored, so timestamps keep
 * increasing across restarts. A chain-backed clock needs no seeding.
 */
@Component
public class ClockSeeder {

    private static final Logger log = LoggerFactory.getLogger(ClockSeeder.class);

    private final LogicalClock clock;
    private final JpaFarmerRegistryStore registryStore;
    private final JpaPracticeLogStore practiceLogStore;

    public ClockSeeder(LogicalClock clock, JpaFarmerRegistryStore registryStore,
                       JpaPracticeLogStore practiceLogStore) {
        this.clock = clock;
        this.registryStore = registryStore;
        this.practiceLogStore = practiceLogStore;
    }

    @PostConstruct
    public void seed() {
        if (!(clock instanceof MonotonicLogicalClock counter)) {
            return;
        }
        long highest = Math.max(registryStore.highestTimestamp(), practiceLogStore.highestTimestamp());
        if (highest >= 0) {
            counter.advancePast(highest);
            log.info("Logical clock resumed at {} (highest stored timestamp {})", counter.current(), highest);
        }
    }
}
