package com.scout.exception;

/**
 * Retryable provider failure: timeouts, 5xx responses, rate limiting, dropped connections.
 */
public class TransientProviderException extends ProviderException {

    public TransientProviderException(String message, Integer statusCode, String errorType) {
        this(message, statusCode, errorType, null);
    }

    public TransientProviderException(String message, Integer statusCode, String errorType, Throwable cause) {
        super(message, statusCode, errorType, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
