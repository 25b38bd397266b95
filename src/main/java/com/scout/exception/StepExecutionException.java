package com.scout.exception;

import lombok.Getter;

/**
 * Wraps any failure raised by an injected pipeline step.
 */
@Getter
public class StepExecutionException extends RuntimeException {

    private final String step;

    public StepExecutionException(String step, Throwable cause) {
        super(capitalize(step) + " step failed: " + describe(cause), cause);
        this.step = step;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static String capitalize(String text) {
        if (text == null || text.isEmpty()) {
            return "Unknown";
        }
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
