package com.agrotrace.core.result;

/**
 * Classification of precondition failures.
 */
public enum ErrorCategory {
    AUTHORIZATION,    // Caller lacks the required role
    NOT_FOUND,        // Target record absent
    VALIDATION,       // Malformed input
    STATE_CONFLICT,   // Operation not valid in the record's current status
    TRANSFER          // Value transfer rejected by the ledger
}
