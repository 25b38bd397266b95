package com.scout.service.pipeline;

import lombok.Builder;
import lombok.Value;

/**
 * Per-run switches.
 */
@Value
@Builder
public class RunOptions {

    /**
     * Record the definition's optional step as skipped instead of running it.
     */
    boolean skipOptional;

    public static RunOptions defaults() {
        return RunOptions.builder().build();
    }
}
