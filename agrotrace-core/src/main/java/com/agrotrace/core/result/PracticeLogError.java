package com.agrotrace.core.result;

/**
 * Error codes of the practice log (200-range). 201 is unassigned.
 */
public enum PracticeLogError implements ErrorCode {
    NOT_AUTHORIZED(200, ErrorCategory.AUTHORIZATION),
    NOT_VERIFIED(202, ErrorCategory.AUTHORIZATION),
    INVALID_INPUT(203, ErrorCategory.VALIDATION),
    LOG_NOT_FOUND(204, ErrorCategory.NOT_FOUND),
    ALREADY_MODERATED(205, ErrorCategory.STATE_CONFLICT);

    private final int code;
    private final ErrorCategory category;

    PracticeLogError(int code, ErrorCategory category) {
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
