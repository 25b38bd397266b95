package com.scout.model.ollama;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Non-streaming response of {@code POST /api/chat}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class OllamaChatResponse {

    @JsonProperty("model")
    private String model;

    @JsonProperty("message")
    private OllamaMessage message;

    @JsonProperty("done")
    private Boolean done;

    @JsonProperty("prompt_eval_count")
    private Integer promptEvalCount;

    @JsonProperty("eval_count")
    private Integer evalCount;

    @JsonProperty("total_duration")
    private Long totalDuration; // nanoseconds
}
