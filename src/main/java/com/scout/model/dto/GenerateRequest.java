package com.scout.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scout.model.InferenceRequest;
import com.scout.model.Message;
import com.scout.model.ResponseFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.List;

/**
 * Body of {@code POST /api/v1/inference/generate}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerateRequest {

    @JsonProperty("messages")
    private List<Message> messages;

    @JsonProperty("system")
    private String system;

    @JsonProperty("temperature")
    private Double temperature;

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    @JsonProperty("response_format")
    private ResponseFormat responseFormat;

    @JsonProperty("module")
    private String module;

    @JsonProperty("purpose")
    private String purpose;

    @JsonProperty("job_id")
    private String jobId;

    @JsonProperty("use_cache")
    private Boolean useCache;

    @JsonProperty("cache_ttl_seconds")
    private Long cacheTtlSeconds;

    public InferenceRequest toInferenceRequest() {
        return InferenceRequest.builder()
                .messages(messages)
                .system(system)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .responseFormat(responseFormat != null ? responseFormat : ResponseFormat.TEXT)
                .module(module)
                .purpose(purpose)
                .jobId(jobId)
                .useCache(useCache == null || useCache)
                .cacheTtl(cacheTtlSeconds != null ? Duration.ofSeconds(cacheTtlSeconds) : null)
                .build();
    }
}
