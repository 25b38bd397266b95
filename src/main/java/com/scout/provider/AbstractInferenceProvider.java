package com.scout.provider;

import com.scout.config.ScoutProperties;
import com.scout.exception.ProviderException;
import com.scout.exception.ProviderTimeoutException;
import com.scout.exception.TerminalProviderException;
import com.scout.exception.TransientProviderException;
import com.scout.model.InferenceResult;
import com.scout.model.ProviderHealth;
import com.scout.model.ProviderRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Abstract base class for inference providers with common functionality:
 * lifecycle, per-call timeout, latency measurement and error classification.
 */
@Slf4j
public abstract class AbstractInferenceProvider implements InferenceProvider {

    protected final WebClient webClient;
    protected final ScoutProperties.InferenceConfig properties;
    protected final String baseUrl;
    protected final String apiKey;

    private volatile boolean initialized;

    protected AbstractInferenceProvider(
            WebClient webClient,
            ScoutProperties.InferenceConfig properties,
            String providerName,
            String defaultBaseUrl) {
        this.webClient = webClient;
        this.properties = properties;

        ScoutProperties.ProviderConfig config = properties.getProviders().get(providerName);
        String configured = config != null ? config.getBaseUrl() : null;
        this.baseUrl = stripTrailingSlash(configured != null && !configured.isBlank() ? configured : defaultBaseUrl);
        this.apiKey = config != null ? config.getApiKey() : null;
    }

    /**
     * Names of the models the backend can serve.
     */
    protected abstract Mono<List<String>> listModels();

    /**
     * Provider-specific completion call.
     */
    protected abstract Mono<InferenceResult> doGenerate(ProviderRequest request);

    /**
     * Whether a missing primary model fails initialization or only logs a warning.
     */
    protected boolean requiresInstalledModel() {
        return true;
    }

    @Override
    public Mono<Void> initialize() {
        if (initialized) {
            log.warn("{} provider already initialized", getName());
            return Mono.empty();
        }

        String model = properties.getModel();
        return listModels()
                .timeout(properties.getTimeout())
                .onErrorMap(e -> new TerminalProviderException(
                        "Failed to connect to " + getName() + " at " + baseUrl + ": " + describe(e),
                        null, "initialization", e))
                .flatMap(models -> {
                    if (!containsModel(models, model)) {
                        String message = "Model " + model + " not found. Available models: " + models;
                        if (requiresInstalledModel()) {
                            return Mono.error(new TerminalProviderException(message, null, "model_not_found"));
                        }
                        log.warn(message);
                    }
                    initialized = true;
                    log.info("{} provider initialized with model: {}", getName(), model);
                    return Mono.<Void>empty();
                });
    }

    @Override
    public Mono<Void> shutdown() {
        return Mono.fromRunnable(() -> {
            initialized = false;
            log.info("{} provider shutdown complete", getName());
        });
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    @Override
    public Mono<InferenceResult> generate(ProviderRequest request) {
        if (!initialized) {
            return Mono.error(new TerminalProviderException(getName() + " provider not initialized", null, "not_initialized"));
        }

        Duration timeout = request.getTimeout() != null ? request.getTimeout() : properties.getTimeout();
        return Mono.defer(() -> {
            long start = System.nanoTime();
            return doGenerate(request)
                    .timeout(timeout)
                    .map(result -> result.toBuilder()
                            .latencyMs((System.nanoTime() - start) / 1_000_000)
                            .requestId(request.getRequestId())
                            .build());
        }).onErrorMap(e -> classify(e, timeout));
    }

    @Override
    public Mono<ProviderHealth> healthCheck() {
        if (!initialized) {
            return Mono.just(ProviderHealth.builder()
                    .status("unavailable")
                    .provider(getName())
                    .error("Not initialized")
                    .build());
        }

        return listModels()
                .timeout(properties.getTimeout())
                .map(models -> ProviderHealth.builder()
                        .status("healthy")
                        .provider(getName())
                        .host(baseUrl)
                        .model(properties.getModel())
                        .fallbackModel(properties.getFallbackModel())
                        .availableModels(models.size())
                        .build())
                .onErrorResume(e -> Mono.just(ProviderHealth.builder()
                        .status("degraded")
                        .provider(getName())
                        .host(baseUrl)
                        .error(describe(e))
                        .build()));
    }

    /**
     * Map any failure to a provider exception.
     * 429, 5xx, connection failures and timeouts are transient; other 4xx are terminal.
     */
    protected ProviderException classify(Throwable error, Duration timeout) {
        if (error instanceof ProviderException providerException) {
            return providerException;
        }

        if (error instanceof TimeoutException) {
            return new ProviderTimeoutException(timeout, error);
        }

        if (error instanceof WebClientResponseException responseException) {
            HttpStatusCode status = responseException.getStatusCode();
            int code = status.value();
            String message = getName() + " error " + code + ": " + responseException.getResponseBodyAsString();

            if (code == 429) {
                return new TransientProviderException(message, code, "rate_limit", error);
            }
            if (code == 408) {
                return new TransientProviderException(message, code, "timeout", error);
            }
            if (status.is5xxServerError()) {
                return new TransientProviderException(message, code, "server_error", error);
            }
            if (code == 401 || code == 403) {
                return new TerminalProviderException(message, code, "auth", error);
            }
            if (code == 404) {
                return new TerminalProviderException(message, code, "not_found", error);
            }
            return new TerminalProviderException(message, code, "bad_request", error);
        }

        if (error instanceof WebClientRequestException) {
            if (hasTimeoutCause(error)) {
                return new ProviderTimeoutException(timeout, error);
            }
            return new TransientProviderException(
                    "Failed to reach " + getName() + " at " + baseUrl + ": " + describe(error), null, "connection_error", error);
        }

        return new TransientProviderException("Unexpected " + getName() + " error: " + describe(error), null, "provider_error", error);
    }

    private static boolean hasTimeoutCause(Throwable error) {
        for (Throwable t = error.getCause(); t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t.getClass().getSimpleName().contains("Timeout")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Installed model names carry a tag (qwen2.5:3b); an untagged name means ":latest".
     */
    static boolean containsModel(List<String> installed, String model) {
        String wanted = model.contains(":") ? model : model + ":latest";
        return installed.stream().anyMatch(name -> name.equals(model) || name.equals(wanted));
    }

    protected static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
