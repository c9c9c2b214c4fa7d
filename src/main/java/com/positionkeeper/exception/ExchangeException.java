package com.positionkeeper.exception;

/**
 * Any failure reported by, or while talking to, the exchange.
 *
 * <p>Callers in the timer loops treat this as transient: the affected group or position
 * is skipped and retried on the next cycle.
 */
public class ExchangeException extends BaseException {

    public ExchangeException(String message) {
        super(ErrorCode.EXCHANGE_ERROR, message);
    }

    public ExchangeException(String message, Throwable cause) {
        super(ErrorCode.EXCHANGE_ERROR, message, cause);
    }

    protected ExchangeException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
