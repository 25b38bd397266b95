package com.scout.service.pipeline;

import com.scout.model.pipeline.PipelineProgress;

/**
 * Receives progress events. Exceptions thrown here are logged and never abort a run.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = progress -> { };

    void onProgress(PipelineProgress progress);
}
