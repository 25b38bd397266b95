package com.scout.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scout.provider.InferenceProvider;
import com.scout.provider.OllamaProvider;
import com.scout.provider.OpenAiCompatibleProvider;
import com.scout.repository.CacheFileRepository;
import com.scout.repository.MetricsFileRepository;
import com.scout.service.InferenceClient;
import com.scout.service.cache.CacheKeyGenerator;
import com.scout.service.cache.CacheStore;
import com.scout.service.metrics.MetricsStore;
import com.scout.service.metrics.collector.OperatingSystemCollector;
import com.scout.service.metrics.collector.SystemCollector;
import com.scout.service.pipeline.PipelineOrchestrator;
import com.scout.service.pipeline.PipelineRunRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * Composition root: builds each core component once and wires references explicitly.
 * Lifecycle methods run as bean init/destroy methods, so stores are ready before the client.
 */
@Configuration
public class InferenceConfiguration {

    private final ScoutProperties properties;

    public InferenceConfiguration(ScoutProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean(initMethod = "initialize", destroyMethod = "shutdown")
    public CacheStore cacheStore(ObjectMapper objectMapper, Clock clock) {
        ScoutProperties.CacheConfig cache = properties.getCache();
        return new CacheStore(
                new CacheFileRepository(cache.getDirectory(), objectMapper),
                cache.getMemoryMaxEntries(),
                cache.getDefaultTtl(),
                clock);
    }

    @Bean
    public CacheKeyGenerator cacheKeyGenerator(ObjectMapper objectMapper) {
        return new CacheKeyGenerator(objectMapper);
    }

    @Bean
    public SystemCollector systemCollector() {
        return new OperatingSystemCollector();
    }

    @Bean(initMethod = "initialize", destroyMethod = "shutdown")
    public MetricsStore metricsStore(ObjectMapper objectMapper, SystemCollector systemCollector, Clock clock) {
        ScoutProperties.MetricsConfig metrics = properties.getMetrics();
        return new MetricsStore(
                new MetricsFileRepository(metrics.getDirectory(), objectMapper),
                systemCollector,
                metrics,
                clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "scout.inference", name = "provider", havingValue = OllamaProvider.NAME, matchIfMissing = true)
    public InferenceProvider ollamaProvider(WebClient webClient) {
        return new OllamaProvider(webClient, properties.getInference());
    }

    @Bean
    @ConditionalOnProperty(prefix = "scout.inference", name = "provider", havingValue = OpenAiCompatibleProvider.NAME)
    public InferenceProvider openAiCompatibleProvider(WebClient webClient) {
        return new OpenAiCompatibleProvider(webClient, properties.getInference());
    }

    @Bean(initMethod = "initialize", destroyMethod = "shutdown")
    public InferenceClient inferenceClient(InferenceProvider provider,
                                           CacheStore cacheStore,
                                           CacheKeyGenerator cacheKeyGenerator,
                                           MetricsStore metricsStore,
                                           ObjectMapper objectMapper,
                                           Clock clock) {
        return new InferenceClient(provider, cacheStore, cacheKeyGenerator, metricsStore,
                properties.getInference(), objectMapper, clock);
    }

    @Bean
    public PipelineRunRegistry pipelineRunRegistry() {
        ScoutProperties.PipelineConfig pipeline = properties.getPipeline();
        return new PipelineRunRegistry(pipeline.getMaxStoredRuns(), pipeline.getRunRetention());
    }

    @Bean
    public PipelineOrchestrator pipelineOrchestrator(PipelineRunRegistry registry, Clock clock) {
        return new PipelineOrchestrator(registry, clock);
    }
}
