package com.positionkeeper.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Stable error codes returned to operators. {@code retryable} marks failures where the same
 * call may succeed later without any change: a busy position or an exchange hiccup.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400, false),
    BAD_REQUEST("BAD_REQUEST", 400, false),
    NOT_FOUND("NOT_FOUND", 404, false),
    CONFLICT("CONFLICT", 409, true),
    INVALID_STATE("INVALID_STATE", 409, false),
    INTERNAL_ERROR("INTERNAL_ERROR", 500, false),
    UNPROTECTED_POSITION("UNPROTECTED_POSITION", 500, false),
    EXCHANGE_ERROR("EXCHANGE_ERROR", 502, true),
    EXCHANGE_TIMEOUT("EXCHANGE_TIMEOUT", 504, true);

    private final String code;
    private final int httpStatus;
    private final boolean retryable;
}
