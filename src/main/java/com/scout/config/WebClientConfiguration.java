package com.scout.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient configuration for HTTP requests to inference providers.
 *
 * <p>The connector timeout is an upper bound only; each call applies its own timeout.
 */
@Configuration
public class WebClientConfiguration {

    private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;

    private final ScoutProperties properties;

    public WebClientConfiguration(ScoutProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient webClient() {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.getInference().getTimeout().multipliedBy(2));

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .build();
    }
}
