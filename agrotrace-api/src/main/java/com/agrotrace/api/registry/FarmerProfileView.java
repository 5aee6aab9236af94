package com.agrotrace.api.registry;

import com.agrotrace.core.domain.FarmerProfile;
import com.agrotrace.core.domain.VerificationStatus;

/**
 * Immutable snapshot of a farmer profile handed to readers.
 */
public record FarmerProfileView(
        long id,
        String principal,
        String name,
        String location,
        long farmSize,
        long registrationTimestamp,
        VerificationStatus verificationStatus,
        Long verificationTimestamp,
        String additionalInfo,
        boolean active
) {

    public static FarmerProfileView of(FarmerProfile profile) {
        return new FarmerProfileView(
                profile.getId(),
                profile.getPrincipal(),
                profile.getName(),
                profile.getLocation(),
                profile.getFarmSize(),
                profile.getRegistrationTimestamp(),
                profile.getVerificationStatus(),
                profile.getVerificationTimestamp(),
                profile.getAdditionalInfo(),
                profile.isActive());
    }
}
