package com.agrotrace.api.registry;

/**
 * One identity to onboard through a batch registration.
 */
public record BatchRegistration(
        String principal,
        String name,
        String location,
        long farmSize,
        String additionalInfo
) {}
