package com.positionkeeper.exception;

/**
 * A remote call did not answer within the configured bound. Never treated as evidence
 * that an order filled or a position closed.
 */
public class ExchangeTimeoutException extends ExchangeException {

    public ExchangeTimeoutException(String operation, long timeoutMs, Throwable cause) {
        super(
                ErrorCode.EXCHANGE_TIMEOUT,
                String.format("Exchange call %s timed out after %dms", operation, timeoutMs),
                cause);
    }
}
