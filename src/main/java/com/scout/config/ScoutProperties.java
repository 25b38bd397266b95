package com.scout.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for Scout.
 */
@Data
@Component
@ConfigurationProperties(prefix = "scout")
public class ScoutProperties {

    private CacheConfig cache = new CacheConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private InferenceConfig inference = new InferenceConfig();
    private PipelineConfig pipeline = new PipelineConfig();

    @Data
    public static class CacheConfig {
        private Path directory = Path.of("data/cache");
        private int memoryMaxEntries = 100;
        private Duration defaultTtl = Duration.ofHours(1);
        private Duration cleanupInterval = Duration.ofMinutes(30);
    }

    @Data
    public static class MetricsConfig {
        private Path directory = Path.of("data/metrics");
        private int retentionDays = 30;
        private Duration archiveInterval = Duration.ofHours(24);
        private boolean systemMetricsEnabled = true;
        private Duration systemMetricsInterval = Duration.ofSeconds(10);
        private Duration systemMetricsMaxAge = Duration.ofHours(24);

        /**
         * Persist the system time series every N samples.
         */
        private int systemMetricsSaveEvery = 30;
    }

    @Data
    public static class InferenceConfig {
        private String provider = "ollama";
        private Map<String, ProviderConfig> providers = new HashMap<>();
        private String model = "qwen2.5:3b";
        private String fallbackModel = "gemma2:2b";
        private double temperature = 0.3;
        private int maxTokens = 2000;
        private Duration timeout = Duration.ofSeconds(120);

        /**
         * Total attempts per call, the first one included.
         */
        private int maxAttempts = 3;

        /**
         * Failed primary attempts after which the rest of the call runs on the fallback model.
         */
        private int fallbackAfterAttempts = 2;

        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(10);
    }

    @Data
    public static class ProviderConfig {
        private String baseUrl;
        private String apiKey;
    }

    @Data
    public static class PipelineConfig {
        private int maxStoredRuns = 500;
        private Duration runRetention = Duration.ofHours(24);
    }
}
