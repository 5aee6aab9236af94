package com.agrotrace.core.result;

/**
 * Numeric error code returned by a rejected operation.
 * The numeric values are a wire contract shared with existing callers and must not change.
 */
public interface ErrorCode {

    int code();

    ErrorCategory category();

    /**
     * Enum constant name, e.g. {@code ALREADY_REGISTERED}.
     */
    String name();
}
