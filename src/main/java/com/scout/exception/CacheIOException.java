package com.scout.exception;

/**
 * File-tier cache failure. Always caught inside the cache store and treated as a miss.
 */
public class CacheIOException extends RuntimeException {

    public CacheIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
