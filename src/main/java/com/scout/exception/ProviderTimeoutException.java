package com.scout.exception;

import java.time.Duration;

/**
 * Provider call exceeded its per-call timeout.
 */
public class ProviderTimeoutException extends TransientProviderException {

    public ProviderTimeoutException(Duration timeout, Throwable cause) {
        super("Request timed out after " + timeout.toMillis() + "ms", null, "timeout", cause);
    }
}
