package com.scout.exception;

/**
 * Metrics could not be written to disk. The in-memory record is kept.
 */
public class MetricsPersistenceException extends RuntimeException {

    public MetricsPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
