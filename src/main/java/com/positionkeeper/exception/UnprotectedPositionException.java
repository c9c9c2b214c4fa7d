package com.positionkeeper.exception;

import java.util.Map;

/**
 * Raised when an entry order filled but neither the full protective set nor the emergency
 * stop could be placed. The position is live on the exchange with no stop and needs an operator.
 */
public class UnprotectedPositionException extends BaseException {

    public UnprotectedPositionException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.UNPROTECTED_POSITION, message, details, cause);
    }
}
