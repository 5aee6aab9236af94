package com.agrotrace.core.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Verification state of a farmer profile.
 * PENDING is the only non-terminal state.
 */
public enum VerificationStatus {
    PENDING("pending"),
    VERIFIED("verified"),
    REJECTED("rejected");

    private final String wireValue;

    VerificationStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * Parses the lower-case wire form. Unknown or null input yields empty.
     */
    public static Optional<VerificationStatus> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (VerificationStatus status : values()) {
            if (status.wireValue.equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
