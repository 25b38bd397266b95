package com.scout.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Fully resolved request handed to a provider for a single attempt.
 */
@Value
@Builder
public class ProviderRequest {

    String requestId;

    String model;

    List<Message> messages;

    String system;

    double temperature;

    int maxTokens;

    ResponseFormat responseFormat;

    Duration timeout;
}
