package com.agrotrace.api.registry;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;

/**
 * Initial role holders and fee of the farmer registry. Only used when the settings record is
 * created for the first time; afterwards the stored record is authoritative.
 */
@Configuration
@ConfigurationProperties(prefix = "agrotrace.registry")
public class RegistryProperties {

    private String owner = "deployer";
    private String verifier;
    private BigInteger registrationFee = BigInteger.valueOf(1_000_000L);
    private String treasuryAccount = "farmer-registry";

    public String getOwner() { return owner; }
    public void setOwner(String owner) { this.owner = owner; }
    /** Defaults to the owner when not set. */
    public String getVerifier() { return verifier != null ? verifier : owner; }
    public void setVerifier(String verifier) { this.verifier = verifier; }
    public BigInteger getRegistrationFee() { return registrationFee; }
    public void setRegistrationFee(BigInteger fee) { this.registrationFee = fee; }
    public String getTreasuryAccount() { return treasuryAccount; }
    public void setTreasuryAccount(String treasuryAccount) { this.treasuryAccount = treasuryAccount; }
}
