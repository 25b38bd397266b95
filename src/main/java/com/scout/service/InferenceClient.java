package com.scout.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scout.config.ScoutProperties;
import com.scout.exception.ProviderException;
import com.scout.exception.ResponseParseException;
import com.scout.exception.RetriesExhaustedException;
import com.scout.exception.TransientProviderException;
import com.scout.model.InferenceHealth;
import com.scout.model.InferenceRequest;
import com.scout.model.InferenceResult;
import com.scout.model.Message;
import com.scout.model.ProviderHealth;
import com.scout.model.ProviderRequest;
import com.scout.model.ResponseFormat;
import com.scout.model.TokenUsage;
import com.scout.model.metrics.RecordRequest;
import com.scout.provider.InferenceProvider;
import com.scout.service.cache.CacheKeyGenerator;
import com.scout.service.cache.CacheStore;
import com.scout.service.metrics.MetricsStore;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Resilient front door to the configured inference provider.
 *
 * Flow per call:
 * 1. Validate and apply configured defaults
 * 2. Cache lookup (keyed on the primary model)
 * 3. Attempt loop: exponential backoff on transient errors, fallback model after
 *    {@code fallbackAfterAttempts} failed primary attempts
 * 4. One metrics entry per provider attempt
 * 5. Cache store on success
 *
 * Cache and metrics failures are logged and never fail the call.
 */
@Slf4j
public class InferenceClient {

    static final String JSON_INSTRUCTION = "You must respond with valid JSON only. No other text.";
    static final double JSON_TEMPERATURE = 0.1;
    static final double MIN_TEMPERATURE = 0.0;
    static final double MAX_TEMPERATURE = 1.0;
    static final int MIN_MAX_TOKENS = 1;
    static final int MAX_MAX_TOKENS = 4096;

    private final InferenceProvider provider;
    private final CacheStore cacheStore;
    private final CacheKeyGenerator keyGenerator;
    private final MetricsStore metricsStore;
    private final ScoutProperties.InferenceConfig properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong totalTokens = new AtomicLong();
    private volatile Instant lastRequestTime;
    private volatile String lastError;
    private volatile boolean initialized;

    public InferenceClient(InferenceProvider provider,
                           CacheStore cacheStore,
                           CacheKeyGenerator keyGenerator,
                           MetricsStore metricsStore,
                           ScoutProperties.InferenceConfig properties,
                           ObjectMapper objectMapper,
                           Clock clock) {
        this.provider = provider;
        this.cacheStore = cacheStore;
        this.keyGenerator = keyGenerator;
        this.metricsStore = metricsStore;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Connect the provider. A failure leaves the client unavailable instead of aborting startup.
     */
    public void initialize() {
        if (initialized) {
            log.warn("Inference client already initialized");
            return;
        }
        try {
            provider.initialize().block();
            initialized = true;
            log.info("Inference client initialized: provider={}, model={}, fallback={}",
                    provider.getName(), properties.getModel(), properties.getFallbackModel());
        } catch (RuntimeException e) {
            lastError = e.getMessage();
            log.error("Inference provider {} failed to initialize, client unavailable: {}",
                    provider.getName(), e.getMessage());
        }
    }

    public void shutdown() {
        if (!initialized) {
            return;
        }
        provider.shutdown().block();
        initialized = false;
        log.info("Inference client shutdown complete");
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Generate a completion.
     *
     * @param request caller request; null generation parameters take configured defaults
     * @return completion, {@code cached=true} when served from the cache
     */
    public Mono<InferenceResult> generate(InferenceRequest request) {
        return Mono.defer(() -> {
            InferenceRequest resolved = resolve(request);
            lastRequestTime = clock.instant();

            if (!resolved.isUseCache()) {
                return callWithRetry(resolved);
            }

            String cacheKey = keyGenerator.generateKey(resolved, properties.getModel());
            return lookupCache(cacheKey)
                    .switchIfEmpty(Mono.defer(() -> callWithRetry(resolved)
                            .flatMap(result -> storeInCache(cacheKey, resolved, result))));
        });
    }

    /**
     * Single-prompt convenience over {@link #generate(InferenceRequest)}.
     */
    public Mono<InferenceResult> generateText(String prompt, String system, String module) {
        return generate(InferenceRequest.builder()
                .messages(List.of(Message.user(prompt)))
                .system(system)
                .module(module)
                .build());
    }

    /**
     * Generate and parse a JSON completion.
     * Markdown code fences around the payload are removed before parsing.
     *
     * @throws ResponseParseException (as error signal) when the completion is not valid JSON
     */
    public Mono<JsonNode> generateJson(String prompt, String system, String module) {
        String jsonSystem = system != null && !system.isBlank()
                ? system + "\n\n" + JSON_INSTRUCTION
                : JSON_INSTRUCTION;

        InferenceRequest request = InferenceRequest.builder()
                .messages(List.of(Message.user(prompt)))
                .system(jsonSystem)
                .temperature(JSON_TEMPERATURE)
                .responseFormat(ResponseFormat.JSON)
                .module(module)
                .build();

        return generate(request).map(result -> parseJson(result.getContent()));
    }

    public Mono<InferenceHealth> healthCheck() {
        return provider.healthCheck()
                .onErrorResume(e -> Mono.just(ProviderHealth.builder()
                        .status("degraded")
                        .provider(provider.getName())
                        .error(e.getMessage())
                        .build()))
                .map(providerHealth -> InferenceHealth.builder()
                        .status(overallStatus(providerHealth))
                        .provider(providerHealth)
                        .totalRequests(totalRequests.get())
                        .cacheHits(cacheHits.get())
                        .totalTokens(totalTokens.get())
                        .lastRequestTime(lastRequestTime)
                        .lastError(lastError)
                        .build());
    }

    private String overallStatus(ProviderHealth providerHealth) {
        if (!initialized || "unavailable".equals(providerHealth.getStatus())) {
            return "unavailable";
        }
        if (lastError != null || "degraded".equals(providerHealth.getStatus())) {
            return "degraded";
        }
        return "healthy";
    }

    // ---------------------------------------------------------------------
    // Request resolution
    // ---------------------------------------------------------------------

    private InferenceRequest resolve(InferenceRequest request) {
        if (request == null || request.getMessages() == null || request.getMessages().isEmpty()) {
            throw new IllegalArgumentException("At least one message is required");
        }

        double temperature = request.getTemperature() != null ? request.getTemperature() : properties.getTemperature();
        if (temperature < MIN_TEMPERATURE || temperature > MAX_TEMPERATURE) {
            throw new IllegalArgumentException("temperature must be between 0 and 1, got " + temperature);
        }

        int maxTokens = request.getMaxTokens() != null ? request.getMaxTokens() : properties.getMaxTokens();
        if (maxTokens < MIN_MAX_TOKENS || maxTokens > MAX_MAX_TOKENS) {
            throw new IllegalArgumentException("max_tokens must be between 1 and 4096, got " + maxTokens);
        }

        return request.toBuilder()
                .temperature(temperature)
                .maxTokens(maxTokens)
                .responseFormat(request.getResponseFormat() != null ? request.getResponseFormat() : ResponseFormat.TEXT)
                .timeout(request.getTimeout() != null ? request.getTimeout() : properties.getTimeout())
                .build();
    }

    // ---------------------------------------------------------------------
    // Cache
    // ---------------------------------------------------------------------

    private Mono<InferenceResult> lookupCache(String cacheKey) {
        return Mono.fromCallable(() -> cacheStore.get(cacheKey))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(Mono::justOrEmpty)
                .map(node -> {
                    try {
                        return objectMapper.treeToValue(node, InferenceResult.class);
                    } catch (JsonProcessingException e) {
                        throw new IllegalStateException("Unreadable cached result", e);
                    }
                })
                .map(cached -> {
                    totalRequests.incrementAndGet();
                    cacheHits.incrementAndGet();
                    log.debug("Serving cached completion for key {}", cacheKey.substring(0, Math.min(16, cacheKey.length())));
                    return cached.toBuilder().cached(true).build();
                })
                .onErrorResume(e -> {
                    log.warn("Cache lookup failed, calling provider: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<InferenceResult> storeInCache(String cacheKey, InferenceRequest request, InferenceResult result) {
        return Mono.fromRunnable(() -> {
                    try {
                        cacheStore.put(cacheKey, objectMapper.valueToTree(result), request.getCacheTtl());
                    } catch (RuntimeException e) {
                        log.warn("Cache store failed for request {}: {}", result.getRequestId(), e.getMessage());
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .thenReturn(result);
    }

    // ---------------------------------------------------------------------
    // Attempt loop
    // ---------------------------------------------------------------------

    private Mono<InferenceResult> callWithRetry(InferenceRequest request) {
        int maxAttempts = Math.max(1, properties.getMaxAttempts());
        String requestId = UUID.randomUUID().toString();
        AtomicInteger attempt = new AtomicInteger();

        return Mono.defer(() -> attempt(request, requestId, attempt.getAndIncrement()))
                .retryWhen(Retry.backoff(maxAttempts - 1, properties.getInitialBackoff())
                        .maxBackoff(properties.getMaxBackoff())
                        .jitter(0)
                        .filter(InferenceClient::isRetryable)
                        .doBeforeRetry(signal -> log.warn("Attempt {}/{} failed for request {}: {}. Retrying...",
                                signal.totalRetries() + 1, maxAttempts, requestId, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> new RetriesExhaustedException(maxAttempts, signal.failure())))
                .doOnNext(result -> {
                    totalRequests.incrementAndGet();
                    totalTokens.addAndGet(result.getUsage() != null ? result.getUsage().getTotalTokens() : 0);
                    lastError = null;
                    log.info("Inference completed: request={}, model={}, tokens={}, latency={}ms, retries={}, fallback={}",
                            requestId, result.getModel(),
                            result.getUsage() != null ? result.getUsage().getTotalTokens() : 0,
                            result.getLatencyMs(), result.getRetryCount(), result.isFallbackUsed());
                })
                .doOnError(e -> {
                    totalRequests.incrementAndGet();
                    lastError = e.getMessage();
                    log.error("Inference failed for request {}: {}", requestId, e.getMessage());
                });
    }

    private Mono<InferenceResult> attempt(InferenceRequest request, String requestId, int attemptIndex) {
        boolean fallback = useFallback(attemptIndex);
        String model = fallback ? properties.getFallbackModel() : properties.getModel();
        if (fallback && attemptIndex == properties.getFallbackAfterAttempts()) {
            log.warn("Switching request {} to fallback model {}", requestId, model);
        }

        ProviderRequest providerRequest = ProviderRequest.builder()
                .requestId(requestId)
                .model(model)
                .messages(request.getMessages())
                .system(request.getSystem())
                .temperature(request.getTemperature())
                .maxTokens(request.getMaxTokens())
                .responseFormat(request.getResponseFormat())
                .timeout(request.getTimeout())
                .build();

        long start = System.nanoTime();
        return provider.generate(providerRequest)
                .flatMap(result -> {
                    TokenUsage usage = result.getUsage() != null ? result.getUsage() : TokenUsage.empty();
                    InferenceResult stamped = result.toBuilder()
                            .usage(usage)
                            .model(model)
                            .cached(false)
                            .retryCount(attemptIndex)
                            .fallbackUsed(fallback)
                            .requestId(requestId)
                            .build();
                    return recordAttempt(request, model, start, usage, null, attemptIndex, fallback)
                            .thenReturn(stamped);
                })
                .onErrorResume(e -> {
                    ProviderException error = asProviderException(e);
                    return recordAttempt(request, model, start, TokenUsage.empty(), error.getErrorType(), attemptIndex, fallback)
                            .then(Mono.<InferenceResult>error(error));
                });
    }

    private boolean useFallback(int attemptIndex) {
        String fallbackModel = properties.getFallbackModel();
        return attemptIndex >= properties.getFallbackAfterAttempts()
                && fallbackModel != null
                && !fallbackModel.isBlank()
                && !fallbackModel.equals(properties.getModel());
    }

    private Mono<Void> recordAttempt(InferenceRequest request,
                                     String model,
                                     long startNanos,
                                     TokenUsage usage,
                                     String errorType,
                                     int attemptIndex,
                                     boolean fallback) {
        RecordRequest record = RecordRequest.builder()
                .model(model)
                .durationSeconds((System.nanoTime() - startNanos) / 1_000_000_000.0)
                .promptTokens(usage.getInputTokens())
                .completionTokens(usage.getOutputTokens())
                .success(errorType == null)
                .module(request.getModule())
                .jobId(request.getJobId())
                .errorType(errorType)
                .retryCount(attemptIndex)
                .fallbackUsed(fallback)
                .build();

        return Mono.<Void>fromRunnable(() -> {
                    try {
                        metricsStore.record(record);
                    } catch (RuntimeException e) {
                        log.warn("Metrics recording failed for model {}: {}", model, e.getMessage());
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static ProviderException asProviderException(Throwable error) {
        if (error instanceof ProviderException providerException) {
            return providerException;
        }
        return new TransientProviderException("Unexpected provider error: " + error.getMessage(), null, "provider_error", error);
    }

    private static boolean isRetryable(Throwable error) {
        return error instanceof ProviderException providerException && providerException.isRetryable();
    }

    // ---------------------------------------------------------------------
    // Structured output
    // ---------------------------------------------------------------------

    JsonNode parseJson(String content) {
        String text = stripCodeFences(content != null ? content.trim() : "");
        if (text.isEmpty()) {
            throw new ResponseParseException("Failed to parse JSON response: empty completion", null);
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ResponseParseException("Failed to parse JSON response: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Drop the opening fence line (with its language tag) and the closing fence line.
     */
    static String stripCodeFences(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        List<String> lines = Arrays.asList(text.split("\n", -1));
        int end = lines.size();
        if (end > 1 && lines.get(end - 1).trim().equals("```")) {
            end--;
        }
        return String.join("\n", lines.subList(1, Math.max(1, end))).trim();
    }
}
