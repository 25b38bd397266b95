package com.scout.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scout.config.JacksonConfiguration;
import com.scout.config.ScoutProperties;
import com.scout.exception.ProviderTimeoutException;
import com.scout.exception.ResponseParseException;
import com.scout.exception.RetriesExhaustedException;
import com.scout.exception.TerminalProviderException;
import com.scout.exception.TransientProviderException;
import com.scout.model.InferenceHealth;
import com.scout.model.InferenceRequest;
import com.scout.model.InferenceResult;
import com.scout.model.Message;
import com.scout.model.ProviderRequest;
import com.scout.model.ResponseFormat;
import com.scout.model.metrics.MetricsEntry;
import com.scout.repository.CacheFileRepository;
import com.scout.repository.MetricsFileRepository;
import com.scout.service.cache.CacheKeyGenerator;
import com.scout.service.cache.CacheStore;
import com.scout.service.metrics.MetricsStore;
import com.scout.support.FakeInferenceProvider;
import com.scout.support.FakeSystemCollector;
import com.scout.support.HangingInferenceProvider;
import com.scout.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class InferenceClientTest {

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private MutableClock clock;
    private ScoutProperties.InferenceConfig config;
    private FakeInferenceProvider provider;
    private CacheStore cacheStore;
    private MetricsStore metricsStore;
    private InferenceClient client;

    @BeforeEach
    void setUp() {
        objectMapper = new JacksonConfiguration().objectMapper();
        clock = new MutableClock(Instant.parse("2025-03-15T12:00:00Z"));

        config = new ScoutProperties.InferenceConfig();
        config.setModel("primary:3b");
        config.setFallbackModel("fallback:2b");
        config.setMaxAttempts(3);
        config.setFallbackAfterAttempts(2);
        config.setInitialBackoff(Duration.ofMillis(1));
        config.setMaxBackoff(Duration.ofMillis(5));

        ScoutProperties.MetricsConfig metricsConfig = new ScoutProperties.MetricsConfig();
        metricsConfig.setDirectory(tempDir.resolve("metrics"));
        metricsConfig.setSystemMetricsEnabled(false);

        cacheStore = new CacheStore(new CacheFileRepository(tempDir.resolve("cache"), objectMapper), 10, Duration.ofHours(1), clock);
        cacheStore.initialize();
        metricsStore = new MetricsStore(new MetricsFileRepository(tempDir.resolve("metrics"), objectMapper),
                new FakeSystemCollector(), metricsConfig, clock);
        metricsStore.initialize();

        provider = new FakeInferenceProvider();
        client = new InferenceClient(provider, cacheStore, new CacheKeyGenerator(objectMapper),
                metricsStore, config, objectMapper, clock);
        client.initialize();
    }

    @AfterEach
    void tearDown() {
        client.shutdown();
        metricsStore.shutdown();
        cacheStore.shutdown();
    }

    private static InferenceRequest request(String prompt) {
        return InferenceRequest.builder()
                .messages(List.of(Message.user(prompt)))
                .module("analyzer")
                .jobId("job-7")
                .useCache(false)
                .build();
    }

    private List<MetricsEntry> entriesByAttempt() {
        return metricsStore.getEntries(100, 0).stream()
                .sorted(Comparator.comparingInt(MetricsEntry::getRetryCount))
                .collect(Collectors.toList());
    }

    private static TransientProviderException serverError() {
        return new TransientProviderException("upstream 503", 503, "server_error");
    }

    @Nested
    @DisplayName("Attempt loop")
    class AttemptLoop {

        @Test
        void successOnFirstAttemptRecordsOneEntry() {
            InferenceResult result = client.generate(request("hello")).block();

            assertThat(result.getContent()).isEqualTo("ok");
            assertThat(result.getModel()).isEqualTo("primary:3b");
            assertThat(result.getRetryCount()).isZero();
            assertThat(result.isFallbackUsed()).isFalse();
            assertThat(result.isCached()).isFalse();

            List<MetricsEntry> entries = entriesByAttempt();
            assertThat(entries).hasSize(1);
            assertThat(entries.get(0).isSuccess()).isTrue();
            assertThat(entries.get(0).getModule()).isEqualTo("analyzer");
            assertThat(entries.get(0).getJobId()).isEqualTo("job-7");
            assertThat(entries.get(0).getPromptTokens()).isEqualTo(10);
            assertThat(entries.get(0).getCompletionTokens()).isEqualTo(20);
        }

        @Test
        void transientFailuresStopAtAttemptCeiling() {
            provider.thenFail(serverError()).thenFail(serverError()).thenFail(serverError()).thenFail(serverError());

            StepVerifier.create(client.generate(request("hello")))
                    .expectErrorSatisfies(e -> {
                        assertThat(e).isInstanceOf(RetriesExhaustedException.class);
                        assertThat(((RetriesExhaustedException) e).getAttempts()).isEqualTo(3);
                        assertThat(e.getCause()).isInstanceOf(TransientProviderException.class);
                    })
                    .verify();

            assertThat(provider.getRequests()).hasSize(3);
            List<MetricsEntry> entries = entriesByAttempt();
            assertThat(entries).extracting(MetricsEntry::getRetryCount).containsExactly(0, 1, 2);
            assertThat(entries).allSatisfy(entry -> {
                assertThat(entry.isSuccess()).isFalse();
                assertThat(entry.getErrorType()).isEqualTo("server_error");
            });
        }

        @Test
        void terminalFailureIsNotRetried() {
            provider.thenFail(new TerminalProviderException("bad request", 400, "bad_request"));

            StepVerifier.create(client.generate(request("hello")))
                    .expectError(TerminalProviderException.class)
                    .verify();

            assertThat(provider.getRequests()).hasSize(1);
            assertThat(entriesByAttempt()).singleElement()
                    .satisfies(entry -> assertThat(entry.getErrorType()).isEqualTo("bad_request"));
        }

        @Test
        void unknownErrorsAreRetried() {
            provider.thenFail(new IllegalStateException("socket reset"));

            InferenceResult result = client.generate(request("hello")).block();

            assertThat(result.getRetryCount()).isEqualTo(1);
            assertThat(entriesByAttempt().get(0).getErrorType()).isEqualTo("provider_error");
        }

        @Test
        void fallbackModelTakesOverAfterPrimaryFailures() {
            provider.thenFail(serverError()).thenFail(serverError());

            InferenceResult result = client.generate(request("hello")).block();

            assertThat(result.getModel()).isEqualTo("fallback:2b");
            assertThat(result.isFallbackUsed()).isTrue();
            assertThat(result.getRetryCount()).isEqualTo(2);
            assertThat(provider.getRequests()).extracting(ProviderRequest::getModel)
                    .containsExactly("primary:3b", "primary:3b", "fallback:2b");
            assertThat(entriesByAttempt()).extracting(MetricsEntry::isFallbackUsed)
                    .containsExactly(false, false, true);
        }

        @Test
        void nextCallStartsOnPrimaryAgain() {
            provider.thenFail(serverError()).thenFail(serverError());
            client.generate(request("first")).block();

            InferenceResult second = client.generate(request("second")).block();

            assertThat(second.getModel()).isEqualTo("primary:3b");
            assertThat(second.isFallbackUsed()).isFalse();
        }

        @Test
        void sameModelFallbackIsIgnored() {
            config.setFallbackModel("primary:3b");
            provider.thenFail(serverError()).thenFail(serverError());

            InferenceResult result = client.generate(request("hello")).block();

            assertThat(result.isFallbackUsed()).isFalse();
            assertThat(result.getModel()).isEqualTo("primary:3b");
        }
    }

    @Nested
    @DisplayName("Timeouts and backoff")
    class TimeoutsAndBackoff {

        @Test
        void backoffDelayDoublesBetweenAttempts() {
            config.setInitialBackoff(Duration.ofMillis(150));
            config.setMaxBackoff(Duration.ofSeconds(2));
            provider.thenFail(serverError()).thenFail(serverError()).thenFail(serverError());

            StepVerifier.create(client.generate(request("hello")))
                    .expectError(RetriesExhaustedException.class)
                    .verify(Duration.ofSeconds(10));

            List<Long> calls = provider.getCallNanos();
            assertThat(calls).hasSize(3);
            long firstGapMs = Duration.ofNanos(calls.get(1) - calls.get(0)).toMillis();
            long secondGapMs = Duration.ofNanos(calls.get(2) - calls.get(1)).toMillis();
            assertThat(firstGapMs).isGreaterThanOrEqualTo(150);
            assertThat(secondGapMs).isGreaterThanOrEqualTo(300);
        }

        @Test
        void hangingProviderTimesOutOnEveryAttempt() {
            config.setTimeout(Duration.ofMillis(50));
            InferenceClient hangingClient = new InferenceClient(new HangingInferenceProvider(config), cacheStore,
                    new CacheKeyGenerator(objectMapper), metricsStore, config, objectMapper, clock);
            hangingClient.initialize();
            assertThat(hangingClient.isInitialized()).isTrue();

            try {
                StepVerifier.create(hangingClient.generate(request("hello")))
                        .expectErrorSatisfies(e -> {
                            assertThat(e).isInstanceOf(RetriesExhaustedException.class);
                            assertThat(e.getCause())
                                    .isInstanceOf(ProviderTimeoutException.class)
                                    .hasMessage("Request timed out after 50ms");
                        })
                        .verify(Duration.ofSeconds(10));
            } finally {
                hangingClient.shutdown();
            }

            List<MetricsEntry> entries = entriesByAttempt();
            assertThat(entries).extracting(MetricsEntry::getRetryCount).containsExactly(0, 1, 2);
            assertThat(entries).allSatisfy(entry -> {
                assertThat(entry.isSuccess()).isFalse();
                assertThat(entry.getErrorType()).isEqualTo("timeout");
            });
        }
    }

    @Nested
    @DisplayName("Validation and defaults")
    class Validation {

        @Test
        void rejectsTemperatureOutOfRange() {
            InferenceRequest bad = request("hello").toBuilder().temperature(1.5).build();

            StepVerifier.create(client.generate(bad))
                    .expectError(IllegalArgumentException.class)
                    .verify();
            assertThat(provider.getRequests()).isEmpty();
        }

        @Test
        void rejectsMaxTokensOutOfRange() {
            InferenceRequest bad = request("hello").toBuilder().maxTokens(5000).build();

            StepVerifier.create(client.generate(bad))
                    .expectError(IllegalArgumentException.class)
                    .verify();
        }

        @Test
        void rejectsEmptyMessages() {
            InferenceRequest bad = request("hello").toBuilder().messages(List.of()).build();

            StepVerifier.create(client.generate(bad))
                    .expectError(IllegalArgumentException.class)
                    .verify();
        }

        @Test
        void appliesConfiguredDefaults() {
            client.generate(request("hello")).block();

            ProviderRequest sent = provider.getRequests().get(0);
            assertThat(sent.getTemperature()).isEqualTo(config.getTemperature());
            assertThat(sent.getMaxTokens()).isEqualTo(config.getMaxTokens());
            assertThat(sent.getTimeout()).isEqualTo(config.getTimeout());
            assertThat(sent.getResponseFormat()).isEqualTo(ResponseFormat.TEXT);
        }
    }

    @Nested
    @DisplayName("Caching")
    class Caching {

        @Test
        void cacheHitSkipsProviderAndMetrics() {
            InferenceRequest cacheable = request("hello").toBuilder().useCache(true).build();

            InferenceResult first = client.generate(cacheable).block();
            InferenceResult second = client.generate(cacheable).block();

            assertThat(first.isCached()).isFalse();
            assertThat(second.isCached()).isTrue();
            assertThat(second.getContent()).isEqualTo("ok");
            assertThat(provider.getRequests()).hasSize(1);
            assertThat(metricsStore.getEntries(100, 0)).hasSize(1);

            InferenceHealth health = client.healthCheck().block();
            assertThat(health.getTotalRequests()).isEqualTo(2);
            assertThat(health.getCacheHits()).isEqualTo(1);
        }

        @Test
        void differentParametersMiss() {
            InferenceRequest cacheable = request("hello").toBuilder().useCache(true).build();
            client.generate(cacheable).block();

            client.generate(cacheable.toBuilder().temperature(0.9).build()).block();

            assertThat(provider.getRequests()).hasSize(2);
        }

        @Test
        void cacheExpiresAfterRequestTtl() {
            InferenceRequest cacheable = request("hello").toBuilder()
                    .useCache(true)
                    .cacheTtl(Duration.ofMinutes(5))
                    .build();
            client.generate(cacheable).block();

            clock.advance(Duration.ofMinutes(6));
            InferenceResult again = client.generate(cacheable).block();

            assertThat(again.isCached()).isFalse();
            assertThat(provider.getRequests()).hasSize(2);
        }

        @Test
        void failedCallIsNotCached() {
            provider.thenFail(new TerminalProviderException("denied", 403, "auth"));
            InferenceRequest cacheable = request("hello").toBuilder().useCache(true).build();
            StepVerifier.create(client.generate(cacheable)).expectError().verify();

            InferenceResult result = client.generate(cacheable).block();

            assertThat(result.isCached()).isFalse();
        }
    }

    @Nested
    @DisplayName("Structured output")
    class StructuredOutput {

        @Test
        void parsesJsonAndSendsJsonInstruction() {
            provider.thenReply("{\"title\": \"Engineer\"}");

            JsonNode node = client.generateJson("Extract the title", "You are an extractor.", "rinser").block();

            assertThat(node.get("title").asText()).isEqualTo("Engineer");
            ProviderRequest sent = provider.getRequests().get(0);
            assertThat(sent.getSystem()).isEqualTo("You are an extractor.\n\n" + InferenceClient.JSON_INSTRUCTION);
            assertThat(sent.getTemperature()).isEqualTo(0.1);
            assertThat(sent.getResponseFormat()).isEqualTo(ResponseFormat.JSON);
        }

        @Test
        void stripsMarkdownFences() {
            provider.thenReply("```json\n{\"skills\": [\"java\"]}\n```");

            JsonNode node = client.generateJson("List skills", null, "analyzer").block();

            assertThat(node.get("skills").get(0).asText()).isEqualTo("java");
            assertThat(provider.getRequests().get(0).getSystem()).isEqualTo(InferenceClient.JSON_INSTRUCTION);
        }

        @Test
        void invalidJsonRaisesParseErrorWithoutRetry() {
            provider.thenReply("Sure! Here is the data you asked for.");

            StepVerifier.create(client.generateJson("Extract", null, "rinser"))
                    .expectError(ResponseParseException.class)
                    .verify();
            assertThat(provider.getRequests()).hasSize(1);
        }

        @Test
        void fenceStrippingLeavesPlainTextAlone() {
            assertThat(InferenceClient.stripCodeFences("{\"a\":1}")).isEqualTo("{\"a\":1}");
            assertThat(InferenceClient.stripCodeFences("```\n[1,2]\n```")).isEqualTo("[1,2]");
        }
    }

    @Nested
    @DisplayName("Health")
    class Health {

        @Test
        void healthyAfterSuccessfulCall() {
            client.generate(request("hello")).block();

            InferenceHealth health = client.healthCheck().block();

            assertThat(health.getStatus()).isEqualTo("healthy");
            assertThat(health.getTotalTokens()).isEqualTo(30);
            assertThat(health.getLastRequestTime()).isEqualTo(clock.instant());
        }

        @Test
        void degradedAfterFailure() {
            provider.thenFail(new TerminalProviderException("denied", 401, "auth"));
            StepVerifier.create(client.generate(request("hello"))).expectError().verify();

            InferenceHealth health = client.healthCheck().block();

            assertThat(health.getStatus()).isEqualTo("degraded");
            assertThat(health.getLastError()).isEqualTo("denied");
        }

        @Test
        void unavailableWhenProviderFailsToInitialize() {
            FakeInferenceProvider broken = new FakeInferenceProvider();
            broken.failInitialize = true;
            InferenceClient unavailable = new InferenceClient(broken, cacheStore, new CacheKeyGenerator(objectMapper),
                    metricsStore, config, objectMapper, clock);

            unavailable.initialize();

            assertThat(unavailable.isInitialized()).isFalse();
            assertThat(unavailable.healthCheck().block().getStatus()).isEqualTo("unavailable");
        }
    }
}
