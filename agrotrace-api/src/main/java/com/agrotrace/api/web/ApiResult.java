package com.agrotrace.api.web;

import com.agrotrace.core.result.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON envelope of every API response: the success value, or the numeric error code and its name.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResult<T>(
        boolean ok,
        T value,
        Integer code,
        String error,
        String message
) {

    public static <T> ApiResult<T> ok(T value) {
        return new ApiResult<>(true, value, null, null, null);
    }

    /**
     * Read of a record that does not exist. Carries no error code: reads never fail.
     */
    public static <T> ApiResult<T> absent(String message) {
        return new ApiResult<>(false, null, null, null, message);
    }

    public static <T> ApiResult<T> failure(ErrorCode error, String message) {
        return new ApiResult<>(false, null, error.code(), error.name(), message);
    }
}
