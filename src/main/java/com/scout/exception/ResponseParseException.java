package com.scout.exception;

/**
 * Completion text could not be parsed as structured output.
 * Never retried automatically.
 */
public class ResponseParseException extends InferenceException {

    public ResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
