package com.scout.provider;

import com.scout.config.ScoutProperties;
import com.scout.model.InferenceResult;
import com.scout.model.Message;
import com.scout.model.ProviderRequest;
import com.scout.model.ResponseFormat;
import com.scout.model.TokenUsage;
import com.scout.model.openai.ChatCompletionRequest;
import com.scout.model.openai.ChatCompletionResponse;
import com.scout.model.openai.ChatMessage;
import com.scout.model.openai.Choice;
import com.scout.model.openai.ModelList;
import com.scout.model.openai.Usage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Any server exposing the OpenAI chat completions API (llama.cpp server, vLLM, LM Studio).
 */
@Slf4j
public class OpenAiCompatibleProvider extends AbstractInferenceProvider {

    public static final String NAME = "openai-compatible";
    static final String DEFAULT_BASE_URL = "http://localhost:8080";

    public OpenAiCompatibleProvider(WebClient webClient, ScoutProperties.InferenceConfig properties) {
        super(webClient, properties, NAME, DEFAULT_BASE_URL);
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * Model ids reported by these servers often differ from the configured name.
     */
    @Override
    protected boolean requiresInstalledModel() {
        return false;
    }

    @Override
    protected Mono<List<String>> listModels() {
        return webClient.get()
                .uri(baseUrl + "/v1/models")
                .headers(this::authorize)
                .retrieve()
                .bodyToMono(ModelList.class)
                .map(list -> list.getData() == null
                        ? List.<String>of()
                        : list.getData().stream()
                        .map(ModelList.ModelInfo::getId)
                        .filter(Objects::nonNull)
                        .collect(Collectors.toList()));
    }

    @Override
    protected Mono<InferenceResult> doGenerate(ProviderRequest request) {
        log.debug("Forwarding request {} to {}: model={}", request.getRequestId(), baseUrl, request.getModel());

        return webClient.post()
                .uri(baseUrl + "/v1/chat/completions")
                .headers(this::authorize)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(toChatRequest(request))
                .retrieve()
                .bodyToMono(ChatCompletionResponse.class)
                .map(response -> toResult(response, request));
    }

    private void authorize(HttpHeaders headers) {
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }
    }

    private ChatCompletionRequest toChatRequest(ProviderRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystem() != null && !request.getSystem().isBlank()) {
            messages.add(new ChatMessage("system", request.getSystem()));
        }
        for (Message message : request.getMessages()) {
            messages.add(new ChatMessage(message.getRole().getValue(), message.getContent()));
        }

        return ChatCompletionRequest.builder()
                .model(request.getModel())
                .messages(messages)
                .temperature(request.getTemperature())
                .maxTokens(request.getMaxTokens())
                .stream(false)
                .responseFormat(request.getResponseFormat() == ResponseFormat.JSON
                        ? Map.of("type", "json_object")
                        : null)
                .build();
    }

    private InferenceResult toResult(ChatCompletionResponse response, ProviderRequest request) {
        String content = "";
        if (response.getChoices() != null && !response.getChoices().isEmpty()) {
            Choice choice = response.getChoices().get(0);
            if (choice.getMessage() != null && choice.getMessage().getContent() != null) {
                content = choice.getMessage().getContent();
            }
        }

        Usage usage = response.getUsage();
        return InferenceResult.builder()
                .content(content)
                .usage(TokenUsage.builder()
                        .inputTokens(usage != null ? Objects.requireNonNullElse(usage.getPromptTokens(), 0) : 0)
                        .outputTokens(usage != null ? Objects.requireNonNullElse(usage.getCompletionTokens(), 0) : 0)
                        .build())
                .model(request.getModel())
                .cached(false)
                .build();
    }
}
