package com.agrotrace.api.web;

import com.agrotrace.core.result.ErrorCategory;
import com.agrotrace.core.result.ErrorCode;
import com.agrotrace.core.result.OperationResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Turns operation results into HTTP responses. The status follows the error category.
 */
public final class ApiResponses {

    private ApiResponses() {}

    public static <T> ResponseEntity<ApiResult<T>> of(OperationResult<T> result) {
        return of(result, HttpStatus.OK);
    }

    public static <T> ResponseEntity<ApiResult<T>> created(OperationResult<T> result) {
        return of(result, HttpStatus.CREATED);
    }

    private static <T> ResponseEntity<ApiResult<T>> of(OperationResult<T> result, HttpStatus successStatus) {
        if (result.isOk()) {
            return ResponseEntity.status(successStatus).body(ApiResult.ok(result.value()));
        }
        ErrorCode error = result.error().orElseThrow();
        return ResponseEntity.status(statusFor(error.category()))
                .body(ApiResult.failure(error, describe(error)));
    }

    public static HttpStatus statusFor(ErrorCategory category) {
        return switch (category) {
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case STATE_CONFLICT -> HttpStatus.CONFLICT;
            case TRANSFER -> HttpStatus.PAYMENT_REQUIRED;
        };
    }

    private static String describe(ErrorCode error) {
        return error.name().toLowerCase().replace('_', ' ');
    }
}
