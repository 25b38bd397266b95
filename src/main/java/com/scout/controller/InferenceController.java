package com.scout.controller;

import com.scout.exception.ProviderException;
import com.scout.exception.ProviderTimeoutException;
import com.scout.exception.ResponseParseException;
import com.scout.exception.RetriesExhaustedException;
import com.scout.model.InferenceHealth;
import com.scout.model.InferenceResult;
import com.scout.model.dto.GenerateRequest;
import com.scout.service.InferenceClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Direct access to the inference client, mainly for diagnostics.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/inference")
public class InferenceController {

    private final InferenceClient inferenceClient;

    public InferenceController(InferenceClient inferenceClient) {
        this.inferenceClient = inferenceClient;
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<InferenceHealth>> getHealth() {
        return inferenceClient.healthCheck()
                .map(health -> "unavailable".equals(health.getStatus())
                        ? ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(health)
                        : ResponseEntity.ok(health));
    }

    @PostMapping(value = "/generate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<InferenceResult>> generate(@RequestBody GenerateRequest request) {
        log.info("Received generate request: module={}, purpose={}, messages={}",
                request.getModule(), request.getPurpose(),
                request.getMessages() != null ? request.getMessages().size() : 0);

        return inferenceClient.generate(request.toInferenceRequest())
                .map(ResponseEntity::ok);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "invalid_request", e.getMessage());
    }

    @ExceptionHandler(ResponseParseException.class)
    public ResponseEntity<Map<String, Object>> handleParseError(ResponseParseException e) {
        return error(HttpStatus.BAD_GATEWAY, "parse_error", e.getMessage());
    }

    /**
     * Timeouts map to 504, exhausted transient failures to 503, any other provider error to 502.
     */
    @ExceptionHandler({ProviderException.class, RetriesExhaustedException.class})
    public ResponseEntity<Map<String, Object>> handleProviderError(RuntimeException e) {
        Throwable cause = e instanceof RetriesExhaustedException && e.getCause() != null ? e.getCause() : e;
        if (cause instanceof ProviderTimeoutException) {
            return error(HttpStatus.GATEWAY_TIMEOUT, "timeout", e.getMessage());
        }
        if (e instanceof RetriesExhaustedException) {
            return error(HttpStatus.SERVICE_UNAVAILABLE, "retries_exhausted", e.getMessage());
        }
        ProviderException providerException = (ProviderException) e;
        log.warn("Provider error {}: {}", providerException.getErrorType(), e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, providerException.getErrorType(), e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String type, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", type);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
