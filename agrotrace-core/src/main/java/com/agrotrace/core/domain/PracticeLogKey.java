package com.agrotrace.core.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.io.Serializable;
import java.util.Objects;

/**
 * Composite key of a practice log entry: the farmer principal and its per-farmer sequence number.
 */
@Embeddable
public class PracticeLogKey implements Serializable {

    @Column(name = "farmer", nullable = false, updatable = false)
    private String farmer;

    @Column(name = "sequence_number", nullable = false, updatable = false)
    private long sequenceNumber;

    protected PracticeLogKey() {}

    public PracticeLogKey(String farmer, long sequenceNumber) {
        this.farmer = Objects.requireNonNull(farmer, "Farmer cannot be null");
        if (sequenceNumber < 0) {
            throw new IllegalArgumentException("Sequence number cannot be negative");
        }
        this.sequenceNumber = sequenceNumber;
    }

    public String getFarmer() { return farmer; }
    public long getSequenceNumber() { return sequenceNumber; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PracticeLogKey that)) return false;
        return sequenceNumber == that.sequenceNumber && farmer.equals(that.farmer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(farmer, sequenceNumber);
    }

    @Override
    public String toString() {
        return farmer + "#" + sequenceNumber;
    }
}
