package com.agrotrace.api.registry;

/**
 * Read-only verification capability the registry exposes to collaborators such as the practice log.
 */
@FunctionalInterface
public interface FarmerVerificationSource {

    /**
     * True only for a registered farmer whose verification status is VERIFIED.
     */
    boolean isVerified(String principal);
}
