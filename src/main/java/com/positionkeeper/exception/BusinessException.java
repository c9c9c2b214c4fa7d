package com.positionkeeper.exception;

import java.util.Map;

/**
 * A request the engine refuses: invalid input, a position in the wrong phase, or a position
 * another mutation currently holds.
 */
public class BusinessException extends BaseException {

    public BusinessException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public BusinessException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    /** The position is held by the reconciliation loop, the expiry sweep or another operator call. */
    public static BusinessException positionBusy(String positionId) {
        return new BusinessException(
                ErrorCode.CONFLICT,
                "Position " + positionId + " is being updated, retry shortly",
                Map.of(POSITION_ID, positionId));
    }
}
