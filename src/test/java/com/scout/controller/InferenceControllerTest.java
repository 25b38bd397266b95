package com.scout.controller;

import com.scout.exception.ProviderTimeoutException;
import com.scout.exception.RetriesExhaustedException;
import com.scout.exception.TerminalProviderException;
import com.scout.exception.TransientProviderException;
import com.scout.model.InferenceHealth;
import com.scout.model.InferenceRequest;
import com.scout.model.InferenceResult;
import com.scout.model.TokenUsage;
import com.scout.service.InferenceClient;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(InferenceController.class)
class InferenceControllerTest {

    private static final String BODY = "{\"messages\":[{\"role\":\"user\",\"content\":\"Hi\"}],"
            + "\"module\":\"analyzer\",\"response_format\":\"json\",\"max_tokens\":100,\"cache_ttl_seconds\":60}";

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private InferenceClient inferenceClient;

    private WebTestClient.ResponseSpec postGenerate() {
        return webTestClient.post().uri("/api/v1/inference/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange();
    }

    @Test
    void generateMapsRequestAndReturnsResult() {
        when(inferenceClient.generate(any())).thenReturn(Mono.just(InferenceResult.builder()
                .content("{}")
                .usage(new TokenUsage(3, 4))
                .model("qwen2.5:3b")
                .cached(true)
                .build()));

        postGenerate()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.content").isEqualTo("{}")
                .jsonPath("$.cached").isEqualTo(true)
                .jsonPath("$.usage.output_tokens").isEqualTo(4);

        ArgumentCaptor<InferenceRequest> captor = ArgumentCaptor.forClass(InferenceRequest.class);
        verify(inferenceClient).generate(captor.capture());
        InferenceRequest sent = captor.getValue();
        assertThat(sent.getModule()).isEqualTo("analyzer");
        assertThat(sent.getMaxTokens()).isEqualTo(100);
        assertThat(sent.getCacheTtl()).isEqualTo(Duration.ofSeconds(60));
        assertThat(sent.isUseCache()).isTrue();
        assertThat(sent.getMessages()).hasSize(1);
    }

    @Test
    void validationErrorIsBadRequest() {
        when(inferenceClient.generate(any())).thenReturn(Mono.error(new IllegalArgumentException("temperature out of range")));

        postGenerate().expectStatus().isBadRequest()
                .expectBody().jsonPath("$.error").isEqualTo("invalid_request");
    }

    @Test
    void terminalProviderErrorIsBadGateway() {
        when(inferenceClient.generate(any())).thenReturn(Mono.error(new TerminalProviderException("denied", 401, "auth")));

        postGenerate().expectStatus().isEqualTo(502)
                .expectBody().jsonPath("$.error").isEqualTo("auth");
    }

    @Test
    void exhaustedRetriesAreServiceUnavailable() {
        when(inferenceClient.generate(any())).thenReturn(Mono.error(
                new RetriesExhaustedException(3, new TransientProviderException("upstream 503", 503, "server_error"))));

        postGenerate().expectStatus().isEqualTo(503);
    }

    @Test
    void exhaustedTimeoutsAreGatewayTimeout() {
        when(inferenceClient.generate(any())).thenReturn(Mono.error(
                new RetriesExhaustedException(3, new ProviderTimeoutException(Duration.ofSeconds(120), null))));

        postGenerate().expectStatus().isEqualTo(504)
                .expectBody().jsonPath("$.error").isEqualTo("timeout");
    }

    @Test
    void unavailableHealthIsServiceUnavailable() {
        when(inferenceClient.healthCheck()).thenReturn(Mono.just(InferenceHealth.builder()
                .status("unavailable")
                .build()));

        webTestClient.get().uri("/api/v1/inference/health")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody().jsonPath("$.status").isEqualTo("unavailable");
    }
}
