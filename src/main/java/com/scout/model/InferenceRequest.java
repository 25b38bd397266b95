package com.scout.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.List;

/**
 * Caller-facing request to the inference client.
 *
 * <p>Null generation parameters are filled from configuration before the call.
 * {@code module}, {@code purpose} and {@code jobId} are attribution tags only and
 * never influence the cache key.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class InferenceRequest {

    private List<Message> messages;

    private String system;

    /**
     * Sampling temperature in [0, 1].
     */
    private Double temperature;

    /**
     * Maximum output tokens in [1, 4096].
     */
    private Integer maxTokens;

    @Builder.Default
    private ResponseFormat responseFormat = ResponseFormat.TEXT;

    private String module;

    private String purpose;

    /**
     * Optional correlation id copied into metrics entries.
     */
    private String jobId;

    @Builder.Default
    private boolean useCache = true;

    /**
     * Cache TTL for this response; configuration default when null.
     */
    private Duration cacheTtl;

    /**
     * Per-call provider timeout; configuration default when null.
     */
    private Duration timeout;
}
