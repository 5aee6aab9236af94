package com.agrotrace.core.result;

/**
 * Error codes of the farmer registry (100-range).
 */
public enum RegistryError implements ErrorCode {
    NOT_AUTHORIZED(100, ErrorCategory.AUTHORIZATION),
    ALREADY_REGISTERED(101, ErrorCategory.STATE_CONFLICT),
    INVALID_INPUT(102, ErrorCategory.VALIDATION),
    NOT_REGISTERED(103, ErrorCategory.NOT_FOUND),
    NOT_VERIFIED(104, ErrorCategory.STATE_CONFLICT),
    // Also returned when a profile is simply not in a verifiable state
    ALREADY_VERIFIED(105, ErrorCategory.STATE_CONFLICT),
    INVALID_STATUS(106, ErrorCategory.VALIDATION);

    private final int code;
    private final ErrorCategory category;

    RegistryError(int code, ErrorCategory category) {
        this.code = code;
        this.category = category;
    }

    @Override
    public int code() {
        return code;
    }

    @Override
    public ErrorCategory category() {
        return category;
    }
}
