package com.agrotrace.api.registry;

import java.math.BigInteger;

/**
 * Snapshot of the registry settings record.
 */
public record RegistrySettingsView(
        String owner,
        String verifier,
        BigInteger registrationFee,
        BigInteger contractBalance,
        long farmerCount
) {}
