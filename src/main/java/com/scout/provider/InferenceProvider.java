package com.scout.provider;

import com.scout.model.InferenceResult;
import com.scout.model.ProviderHealth;
import com.scout.model.ProviderRequest;
import reactor.core.publisher.Mono;

/**
 * Text-completion backend used by the inference client.
 * Implementations own the wire format and normalize every response into an {@link InferenceResult}.
 */
public interface InferenceProvider {

    /**
     * Get provider name (e.g., "ollama", "openai-compatible").
     *
     * @return provider name
     */
    String getName();

    /**
     * Connect and verify the configured model is available.
     *
     * @return completes when the provider is ready, errors with a terminal provider exception otherwise
     */
    Mono<Void> initialize();

    Mono<Void> shutdown();

    /**
     * Run a single completion attempt. No retries happen at this level.
     *
     * @param request fully resolved request, model included
     * @return normalized result; errors are {@link com.scout.exception.ProviderException}s
     */
    Mono<InferenceResult> generate(ProviderRequest request);

    Mono<ProviderHealth> healthCheck();

    boolean isInitialized();
}
