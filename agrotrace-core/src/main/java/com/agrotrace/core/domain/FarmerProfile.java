package com.agrotrace.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.Objects;

/**
 * FarmerProfile - Registry record for one onboarded farmer identity.
 *
 * One profile per principal. The numeric id is assigned sequentially from 1 by the registry
 * and never reused. Profiles are never deleted; verification moves PENDING to exactly one of
 * VERIFIED or REJECTED, once.
 */
@Entity
@Table(name = "farmer_profiles", indexes = {
    @Index(name = "idx_farmer_principal", columnList = "principal", unique = true),
    @Index(name = "idx_farmer_verification_status", columnList = "verification_status")
})
public class FarmerProfile {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @NotEmpty
    @Column(name = "principal", nullable = false, updatable = false, unique = true)
    private String principal;

    @NotEmpty
    @Column(name = "name", nullable = false)
    private String name;

    @NotEmpty
    @Column(name = "location", nullable = false)
    private String location;

    @Positive
    @Column(name = "farm_size", nullable = false)
    private long farmSize;

    @Column(name = "registration_timestamp", nullable = false, updatable = false)
    private long registrationTimestamp;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "verification_status", nullable = false)
    private VerificationStatus verificationStatus;

    @Column(name = "verification_timestamp")
    private Long verificationTimestamp;

    @Column(name = "additional_info")
    private String additionalInfo;

    @Column(name = "active", nullable = false)
    private boolean active;

    protected FarmerProfile() {}

    private FarmerProfile(long id, String principal) {
        this.id = id;
        this.principal = principal;
        this.verificationStatus = VerificationStatus.PENDING;
        this.active = true;
    }

    /**
     * Creates a new PENDING, active profile.
     */
    public static FarmerProfile register(long id, String principal, String name, String location,
                                         long farmSize, String additionalInfo, long registeredAt) {
        if (id < 1) {
            throw new IllegalArgumentException("Farmer id must be positive");
        }
        Objects.requireNonNull(principal, "Principal cannot be null");
        FarmerProfile profile = new FarmerProfile(id, principal);
        profile.name = name;
        profile.location = location;
        profile.farmSize = farmSize;
        profile.additionalInfo = additionalInfo;
        profile.registrationTimestamp = registeredAt;
        return profile;
    }

    /**
     * Records the verifier's decision. Only allowed once, from PENDING.
     */
    public void decideVerification(VerificationStatus decision, long decidedAt) {
        if (decision == null || !decision.isTerminal()) {
            throw new IllegalArgumentException("Decision must be VERIFIED or REJECTED");
        }
        if (this.verificationStatus != VerificationStatus.PENDING) {
            throw new IllegalStateException("Verification already decided for farmer " + id);
        }
        this.verificationStatus = decision;
        this.verificationTimestamp = decidedAt;
    }

    public void rename(String name) {
        this.name = name;
    }

    public void relocate(String location) {
        this.location = location;
    }

    public void resize(long farmSize) {
        if (farmSize <= 0) {
            throw new IllegalArgumentException("Farm size must be positive");
        }
        this.farmSize = farmSize;
    }

    public void describe(String additionalInfo) {
        this.additionalInfo = additionalInfo;
    }

    /**
     * Clears the active flag. There is no way back.
     */
    public void deactivate() {
        this.active = false;
    }

    public boolean isVerified() {
        return verificationStatus == VerificationStatus.VERIFIED;
    }

    // Getters
    public Long getId() { return id; }
    public String getPrincipal() { return principal; }
    public String getName() { return name; }
    public String getLocation() { return location; }
    public long getFarmSize() { return farmSize; }
    public long getRegistrationTimestamp() { return registrationTimestamp; }
    public VerificationStatus getVerificationStatus() { return verificationStatus; }
    public Long getVerificationTimestamp() { return verificationTimestamp; }
    public String getAdditionalInfo() { return additionalInfo; }
    public boolean isActive() { return active; }
}
