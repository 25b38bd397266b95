package com.scout.exception;

import lombok.Getter;

/**
 * Raised to the caller once every allowed attempt of a call has failed.
 */
@Getter
public class RetriesExhaustedException extends InferenceException {

    private final int attempts;

    public RetriesExhaustedException(int attempts, Throwable lastError) {
        super("All " + attempts + " attempts failed. Last error: "
                + (lastError != null ? lastError.getMessage() : "unknown"), lastError);
        this.attempts = attempts;
    }
}
