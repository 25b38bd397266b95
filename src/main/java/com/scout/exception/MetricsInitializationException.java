package com.scout.exception;

public class MetricsInitializationException extends RuntimeException {

    public MetricsInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
