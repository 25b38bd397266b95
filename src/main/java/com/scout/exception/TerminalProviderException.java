package com.scout.exception;

/**
 * Non-retryable provider failure: malformed request, authentication, missing model.
 */
public class TerminalProviderException extends ProviderException {

    public TerminalProviderException(String message, Integer statusCode, String errorType) {
        this(message, statusCode, errorType, null);
    }

    public TerminalProviderException(String message, Integer statusCode, String errorType, Throwable cause) {
        super(message, statusCode, errorType, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
