package com.agrotrace.api.access;

/**
 * Roles a caller can hold with respect to an operation.
 */
public enum Role {
    OWNER,      // Owner of the registry or of the practice log
    VERIFIER,   // Decides farmer verification
    MODERATOR,  // Decides practice log moderation
    SELF        // Caller acting on its own record
}
