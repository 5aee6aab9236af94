package com.agrotrace.core.domain;

import jakarta.persistence.*;

/**
 * Next sequence number to hand out for one farmer's practice log.
 */
@Entity
@Table(name = "practice_log_counters")
public class PracticeLogCounter {

    @Id
    @Column(name = "farmer", nullable = false, updatable = false)
    private String farmer;

    @Column(name = "next_sequence", nullable = false)
    private long nextSequence;

    protected PracticeLogCounter() {}

    public PracticeLogCounter(String farmer) {
        this.farmer = farmer;
        this.nextSequence = 0;
    }

    /**
     * Returns the sequence number to use now and moves the counter past it.
     */
    public long claimNext() {
        return nextSequence++;
    }

    public String getFarmer() { return farmer; }
    public long getNextSequence() { return nextSequence; }
}
