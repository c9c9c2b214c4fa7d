package com.positionkeeper.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;

/**
 * Root of every failure the engine reports. Details keep their insertion order and may hold
 * null values (an unknown fill price, a missing order id). A failure tied to one position
 * carries its id under {@link #POSITION_ID}.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    public static final String POSITION_ID = "positionId";

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, cause);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public Optional<String> positionId() {
        return Optional.ofNullable(details.get(POSITION_ID)).map(Object::toString);
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
