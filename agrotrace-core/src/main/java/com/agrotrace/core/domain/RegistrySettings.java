package com.agrotrace.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;

import java.math.BigInteger;
import java.util.Objects;

/**
 * RegistrySettings - Singleton configuration record of the farmer registry.
 *
 * Holds the role assignments (owner, verifier), the registration fee, the accumulated fee
 * balance and the id sequence. Exactly one row exists, with id {@link #SINGLETON_ID}.
 */
@Entity
@Table(name = "registry_settings")
public class RegistrySettings {

    public static final long SINGLETON_ID = 1L;

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @NotBlank
    @Column(name = "owner", nullable = false)
    private String owner;

    @NotBlank
    @Column(name = "verifier", nullable = false)
    private String verifier;

    @Column(name = "registration_fee", nullable = false, precision = 38, scale = 0)
    private BigInteger registrationFee;

    @Column(name = "contract_balance", nullable = false, precision = 38, scale = 0)
    private BigInteger contractBalance;

    @Column(name = "next_farmer_id", nullable = false)
    private long nextFarmerId;

    protected RegistrySettings() {}

    public static RegistrySettings initial(String owner, String verifier, BigInteger registrationFee) {
        RegistrySettings settings = new RegistrySettings();
        settings.id = SINGLETON_ID;
        settings.owner = Objects.requireNonNull(owner, "Owner cannot be null");
        settings.verifier = Objects.requireNonNull(verifier, "Verifier cannot be null");
        settings.registrationFee = requireNonNegative(registrationFee);
        settings.contractBalance = BigInteger.ZERO;
        settings.nextFarmerId = 1;
        return settings;
    }

    /**
     * Returns the id to assign now and moves the sequence past it.
     */
    public long allocateFarmerId() {
        return nextFarmerId++;
    }

    public void creditBalance(BigInteger amount) {
        this.contractBalance = contractBalance.add(requireNonNegative(amount));
    }

    public void debitBalance(BigInteger amount) {
        BigInteger remaining = contractBalance.subtract(requireNonNegative(amount));
        if (remaining.signum() < 0) {
            throw new IllegalStateException("Contract balance cannot go negative");
        }
        this.contractBalance = remaining;
    }

    public void changeOwner(String owner) {
        this.owner = Objects.requireNonNull(owner, "Owner cannot be null");
    }

    public void changeVerifier(String verifier) {
        this.verifier = Objects.requireNonNull(verifier, "Verifier cannot be null");
    }

    public void changeRegistrationFee(BigInteger fee) {
        this.registrationFee = requireNonNegative(fee);
    }

    private static BigInteger requireNonNegative(BigInteger amount) {
        Objects.requireNonNull(amount, "Amount cannot be null");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Amount cannot be negative");
        }
        return amount;
    }

    // Getters
    public Long getId() { return id; }
    public String getOwner() { return owner; }
    public String getVerifier() { return verifier; }
    public BigInteger getRegistrationFee() { return registrationFee; }
    public BigInteger getContractBalance() { return contractBalance; }
    public long getNextFarmerId() { return nextFarmerId; }
}
