package com.scout.provider;

import com.scout.config.ScoutProperties;
import com.scout.model.InferenceResult;
import com.scout.model.Message;
import com.scout.model.ProviderRequest;
import com.scout.model.ResponseFormat;
import com.scout.model.TokenUsage;
import com.scout.model.ollama.OllamaChatRequest;
import com.scout.model.ollama.OllamaChatResponse;
import com.scout.model.ollama.OllamaMessage;
import com.scout.model.ollama.OllamaTagsResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Local Ollama server.
 * Uses {@code POST /api/chat} (non-streaming) and {@code GET /api/tags}.
 */
@Slf4j
public class OllamaProvider extends AbstractInferenceProvider {

    public static final String NAME = "ollama";
    static final String DEFAULT_BASE_URL = "http://localhost:11434";

    public OllamaProvider(WebClient webClient, ScoutProperties.InferenceConfig properties) {
        super(webClient, properties, NAME, DEFAULT_BASE_URL);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected Mono<List<String>> listModels() {
        return webClient.get()
                .uri(baseUrl + "/api/tags")
                .retrieve()
                .bodyToMono(OllamaTagsResponse.class)
                .map(response -> response.getModels() == null
                        ? List.<String>of()
                        : response.getModels().stream()
                        .map(OllamaTagsResponse.Model::getName)
                        .filter(Objects::nonNull)
                        .collect(Collectors.toList()));
    }

    @Override
    protected Mono<InferenceResult> doGenerate(ProviderRequest request) {
        log.debug("Sending request {} to Ollama: model={}", request.getRequestId(), request.getModel());

        return webClient.post()
                .uri(baseUrl + "/api/chat")
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(toOllamaRequest(request))
                .retrieve()
                .bodyToMono(OllamaChatResponse.class)
                .map(response -> toResult(response, request));
    }

    private OllamaChatRequest toOllamaRequest(ProviderRequest request) {
        List<OllamaMessage> messages = new ArrayList<>();
        if (request.getSystem() != null && !request.getSystem().isBlank()) {
            messages.add(new OllamaMessage("system", request.getSystem()));
        }
        for (Message message : request.getMessages()) {
            messages.add(new OllamaMessage(message.getRole().getValue(), message.getContent()));
        }

        return OllamaChatRequest.builder()
                .model(request.getModel())
                .messages(messages)
                .stream(false)
                .format(request.getResponseFormat() == ResponseFormat.JSON ? "json" : null)
                .options(OllamaChatRequest.Options.builder()
                        .temperature(request.getTemperature())
                        .numPredict(request.getMaxTokens())
                        .build())
                .build();
    }

    private InferenceResult toResult(OllamaChatResponse response, ProviderRequest request) {
        String content = response.getMessage() != null && response.getMessage().getContent() != null
                ? response.getMessage().getContent()
                : "";

        return InferenceResult.builder()
                .content(content)
                .usage(TokenUsage.builder()
                        .inputTokens(Objects.requireNonNullElse(response.getPromptEvalCount(), 0))
                        .outputTokens(Objects.requireNonNullElse(response.getEvalCount(), 0))
                        .build())
                .model(request.getModel())
                .cached(false)
                .build();
    }
}
