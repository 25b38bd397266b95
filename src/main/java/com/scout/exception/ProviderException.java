package com.scout.exception;

import lombok.Getter;

/**
 * Error reported by an inference provider.
 * Subclasses decide whether the failure is worth retrying.
 */
@Getter
public abstract class ProviderException extends InferenceException {

    /**
     * HTTP status returned by the provider, if any.
     */
    private final Integer statusCode;

    /**
     * Short tag recorded in metrics entries (e.g. "timeout", "rate_limit").
     */
    private final String errorType;

    protected ProviderException(String message, Integer statusCode, String errorType, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.errorType = errorType;
    }

    /**
     * Whether another attempt may succeed.
     */
    public abstract boolean isRetryable();
}
