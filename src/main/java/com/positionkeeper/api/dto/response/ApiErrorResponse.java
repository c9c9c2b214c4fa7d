package com.positionkeeper.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.positionkeeper.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error envelope: {@code {success: false, error: {...}}}. {@code retryable} tells an operator
 * whether repeating the same call can succeed; {@code positionId} names the position the
 * failure concerns, when there is one.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return of(errorCode, message, details, null, path);
    }

    public static ApiErrorResponse of(
            ErrorCode errorCode, String message, Map<String, Object> details, String positionId, String path) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .message(message)
                .retryable(errorCode.isRetryable())
                .positionId(positionId)
                .details(details == null || details.isEmpty() ? null : details)
                .timestamp(Instant.now())
                .path(path)
                .build());
    }

    @Getter
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetail {
        private final String code;
        private final String message;
        private final boolean retryable;
        private final String positionId;
        private final Map<String, Object> details;
        private final Instant timestamp;
        private final String path;
    }
}
