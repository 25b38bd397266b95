package com.scout.model.ollama;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of {@code POST /api/chat}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OllamaChatRequest {

    @JsonProperty("model")
    private String model;

    @JsonProperty("messages")
    private List<OllamaMessage> messages;

    @JsonProperty("stream")
    private Boolean stream;

    /**
     * "json" for structured output, absent otherwise.
     */
    @JsonProperty("format")
    private String format;

    @JsonProperty("options")
    private Options options;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Options {

        @JsonProperty("temperature")
        private Double temperature;

        @JsonProperty("num_predict")
        private Integer numPredict;
    }
}
