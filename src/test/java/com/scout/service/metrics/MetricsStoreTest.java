package com.scout.service.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scout.config.JacksonConfiguration;
import com.scout.config.ScoutProperties;
import com.scout.model.metrics.MetricsEntry;
import com.scout.model.metrics.ModelStats;
import com.scout.model.metrics.PerformanceStatus;
import com.scout.model.metrics.PerformanceSummary;
import com.scout.model.metrics.PerformanceTrend;
import com.scout.model.metrics.RecordRequest;
import com.scout.model.metrics.SystemMetricsPoint;
import com.scout.repository.MetricsFileRepository;
import com.scout.support.FakeSystemCollector;
import com.scout.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class MetricsStoreTest {

    private static final YearMonth FEBRUARY = YearMonth.of(2025, 2);
    private static final YearMonth MARCH = YearMonth.of(2025, 3);

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private MutableClock clock;
    private FakeSystemCollector collector;
    private ScoutProperties.MetricsConfig config;
    private MetricsFileRepository repository;
    private MetricsStore store;

    @BeforeEach
    void setUp() {
        objectMapper = new JacksonConfiguration().objectMapper();
        clock = new MutableClock(Instant.parse("2025-03-15T12:00:00Z"));
        collector = new FakeSystemCollector();

        config = new ScoutProperties.MetricsConfig();
        config.setDirectory(tempDir);
        config.setRetentionDays(30);
        // ticks are driven by hand
        config.setSystemMetricsInterval(Duration.ofHours(1));
        config.setSystemMetricsSaveEvery(3);

        repository = new MetricsFileRepository(tempDir, objectMapper);
        store = newStore();
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    private MetricsStore newStore() {
        return new MetricsStore(repository, collector, config, clock);
    }

    private static RecordRequest.RecordRequestBuilder call(String model, double seconds, int completionTokens) {
        return RecordRequest.builder()
                .model(model)
                .durationSeconds(seconds)
                .promptTokens(50)
                .completionTokens(completionTokens)
                .success(true)
                .module("analyzer");
    }

    private static MetricsEntry storedEntry(String timestamp) {
        return MetricsEntry.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(Instant.parse(timestamp))
                .model("qwen2.5:3b")
                .durationSeconds(4.0)
                .promptTokens(100)
                .completionTokens(40)
                .success(true)
                .build();
    }

    @Nested
    @DisplayName("recording")
    class Recording {

        @Test
        void recordsEntryWithSnapshotAndPersistsShard() {
            store.initialize();

            MetricsEntry entry = store.record(call("qwen2.5:3b", 5.0, 100).jobId("job-1").build());

            assertThat(entry.getId()).isNotBlank();
            assertThat(entry.getTimestamp()).isEqualTo(clock.instant());
            assertThat(entry.getTokensPerSecond()).isEqualTo(20.0);
            assertThat(entry.getCpuPercent()).isEqualTo(25.0);
            assertThat(entry.getTemperatureC()).isEqualTo(55.0);

            List<MetricsEntry> persisted = repository.readActive(MARCH);
            assertThat(persisted).containsExactly(entry);
        }

        @Test
        void omitsSnapshotWhenSystemMetricsDisabled() {
            config.setSystemMetricsEnabled(false);
            store.initialize();

            MetricsEntry entry = store.record(call("qwen2.5:3b", 1.0, 10).build());

            assertThat(entry.getCpuPercent()).isNull();
            assertThat(entry.getMemoryMb()).isNull();
            assertThat(entry.getTemperatureC()).isNull();
        }

        @Test
        void rejectsNegativeDuration() {
            store.initialize();

            assertThatThrownBy(() -> store.record(call("m", -1.0, 10).build()))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void returnsEntryWhenShardCannotBeWritten() throws Exception {
            // a non-empty directory where the shard file belongs makes every write fail
            Path blocker = repository.activeFile(MARCH);
            Files.createDirectories(blocker);
            Files.writeString(blocker.resolve("keep"), "x");
            store.initialize();

            MetricsEntry entry = store.record(call("qwen2.5:3b", 2.0, 10).build());

            assertThat(entry).isNotNull();
            assertThat(store.getEntries(10, 0)).containsExactly(entry);
        }

        @Test
        void rollsOverToNewMonthShard() {
            clock.set(Instant.parse("2025-03-31T23:59:00Z"));
            store.initialize();

            MetricsEntry march = store.record(call("m", 1.0, 10).build());
            clock.advance(Duration.ofMinutes(2));
            MetricsEntry april = store.record(call("m", 1.0, 10).build());

            assertThat(repository.readActive(MARCH)).containsExactly(march);
            assertThat(repository.readActive(YearMonth.of(2025, 4))).containsExactly(april);
            assertThat(store.getEntries(10, 0)).containsExactly(april);
        }

        @Test
        void usedBeforeInitializeFails() {
            assertThatThrownBy(() -> store.getStatus()).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("archival")
    class Archival {

        @Test
        void entryOlderThanRetentionMovesToArchive() {
            MetricsEntry old = storedEntry("2025-02-12T12:00:00Z");
            MetricsEntry recent = storedEntry("2025-03-10T09:00:00Z");
            repository.writeActive(FEBRUARY, List.of(old));
            repository.writeActive(MARCH, List.of(recent));

            store.initialize();

            assertThat(Files.exists(tempDir.resolve("archive/metrics_2025_02.json"))).isTrue();
            assertThat(repository.readArchive(FEBRUARY)).containsExactly(old);
            assertThat(Files.exists(repository.activeFile(FEBRUARY))).isFalse();
            assertThat(repository.readActive(MARCH)).containsExactly(recent);
            assertThat(store.getEntries(10, 0)).containsExactly(recent);
        }

        @Test
        void entryInsideRetentionStaysActive() {
            MetricsEntry boundary = storedEntry("2025-02-13T00:30:00Z");
            repository.writeActive(FEBRUARY, List.of(boundary));

            store.initialize();

            assertThat(repository.readActive(FEBRUARY)).containsExactly(boundary);
            assertThat(repository.readArchive(FEBRUARY)).isEmpty();
        }

        @Test
        void archivingTwiceProducesNoDuplicates() {
            MetricsEntry old = storedEntry("2025-02-01T08:00:00Z");
            repository.writeActive(FEBRUARY, List.of(old));
            store.initialize();
            store.shutdown();

            // same entry still active, as after a crash between archive and active rewrite
            repository.writeActive(FEBRUARY, List.of(old));
            store = newStore();
            store.initialize();

            assertThat(repository.readArchive(FEBRUARY)).containsExactly(old);
            assertThat(store.archiveOldEntries()).isZero();
            assertThat(repository.readArchive(FEBRUARY)).containsExactly(old);
        }

        @Test
        void mergesWithExistingArchive() {
            MetricsEntry archivedEarlier = storedEntry("2025-02-02T08:00:00Z");
            repository.writeArchive(FEBRUARY, List.of(archivedEarlier), Instant.parse("2025-03-05T00:00:00Z"));
            MetricsEntry old = storedEntry("2025-02-03T08:00:00Z");
            repository.writeActive(FEBRUARY, List.of(old));

            store.initialize();

            assertThat(repository.readArchive(FEBRUARY)).containsExactly(archivedEarlier, old);
        }
    }

    @Nested
    @DisplayName("status and trend")
    class StatusAndTrend {

        @Test
        void reportsTodaysCallsAndRates() {
            store.initialize();
            store.record(call("qwen2.5:3b", 2.0, 20).build());
            store.record(call("qwen2.5:3b", 1.0, 0).success(false).errorType("timeout").build());
            store.record(call("gemma2:2b", 4.0, 80).fallbackUsed(true).build());
            store.record(call("gemma2:2b", 4.0, 40).fallbackUsed(true).build());

            PerformanceStatus status = store.getStatus();

            assertThat(status.getCallsToday()).isEqualTo(4);
            assertThat(status.getSuccessRateToday()).isEqualTo(75.0);
            assertThat(status.getPrimaryModelSuccessRate()).isEqualTo(50.0);
            assertThat(status.getFallbackUsageRate()).isEqualTo(50.0);
            assertThat(status.getAvgTokensPerSecond()).isCloseTo(40.0 / 3, within(1e-9));
            assertThat(status.getAvgDurationSeconds()).isCloseTo(10.0 / 3, within(1e-9));
            assertThat(status.getCurrentCpuPercent()).isEqualTo(25.0);
            assertThat(status.isThrottlingWarning()).isFalse();
        }

        @Test
        void warnsAtThrottlingTemperature() {
            collector.temperature = 80.0;
            store.initialize();

            assertThat(store.getStatus().isThrottlingWarning()).isTrue();
        }

        @Test
        void stableWithoutPreviousHour() {
            store.initialize();
            store.record(call("m", 10.0, 100).build());

            assertThat(store.getStatus().getPerformanceTrend()).isEqualTo(PerformanceTrend.STABLE);
        }

        @Test
        void improvingWhenLastHourIsFaster() {
            assertThat(trendFor(100, 120)).isEqualTo(PerformanceTrend.IMPROVING);
        }

        @Test
        void degradingWhenLastHourIsSlower() {
            assertThat(trendFor(100, 80)).isEqualTo(PerformanceTrend.DEGRADING);
        }

        @Test
        void stableForSmallChange() {
            assertThat(trendFor(100, 105)).isEqualTo(PerformanceTrend.STABLE);
        }

        private PerformanceTrend trendFor(int earlierTokens, int laterTokens) {
            clock.set(Instant.parse("2025-03-15T10:30:00Z"));
            store.initialize();
            store.record(call("m", 10.0, earlierTokens).build());
            clock.advance(Duration.ofMinutes(90));
            store.record(call("m", 10.0, laterTokens).build());
            return store.getStatus().getPerformanceTrend();
        }
    }

    @Nested
    @DisplayName("summaries")
    class Summaries {

        @Test
        void computesDurationPercentilesAndBreakdowns() {
            store.initialize();
            for (int i = 1; i <= 20; i++) {
                store.record(call(i % 2 == 0 ? "qwen2.5:3b" : "gemma2:2b", i, 10).build());
            }
            store.record(call("qwen2.5:3b", 30.0, 0).success(false).errorType("timeout").module("creator").build());
            store.record(call("qwen2.5:3b", 30.0, 0).success(false).errorType("timeout").module(null).build());

            PerformanceSummary summary = store.getSummary(null, null);

            assertThat(summary.getTotalCalls()).isEqualTo(22);
            assertThat(summary.getSuccessfulCalls()).isEqualTo(20);
            assertThat(summary.getMedianDurationSeconds()).isEqualTo(10.5);
            assertThat(summary.getP95DurationSeconds()).isEqualTo(20.0);
            assertThat(summary.getErrorBreakdown()).isEqualTo(Map.of("timeout", 2));
            assertThat(summary.getSuccessRate()).isCloseTo(20 * 100.0 / 22, within(1e-9));
            assertThat(summary.getModelStats()).containsOnlyKeys("qwen2.5:3b", "gemma2:2b");
            assertThat(summary.getModelStats().get("qwen2.5:3b").getTotalCalls()).isEqualTo(12);
            assertThat(summary.getModuleStats()).containsOnlyKeys("analyzer", "creator", "unknown");
            assertThat(summary.getAvgCpuPercent()).isEqualTo(25.0);
            assertThat(summary.getPeriodStart()).isEqualTo(Instant.parse("2025-03-01T00:00:00Z"));
        }

        @Test
        void emptyPeriodHasZeroTotals() {
            store.initialize();

            PerformanceSummary summary = store.getSummary(null, null);

            assertThat(summary.getTotalCalls()).isZero();
            assertThat(summary.getAvgCpuPercent()).isNull();
        }

        @Test
        void includesArchivedEntriesOfEarlierMonths() {
            MetricsEntry archived = storedEntry("2025-02-05T10:00:00Z");
            repository.writeArchive(FEBRUARY, List.of(archived), Instant.parse("2025-03-08T00:00:00Z"));
            store.initialize();
            store.record(call("qwen2.5:3b", 2.0, 20).build());

            PerformanceSummary summary = store.getSummary(Instant.parse("2025-02-01T00:00:00Z"), null);

            assertThat(summary.getTotalCalls()).isEqualTo(2);
            assertThat(summary.getTotalTokens()).isEqualTo(140 + 70);
        }

        @Test
        void comparesModelsOfCurrentMonth() {
            store.initialize();
            store.record(call("qwen2.5:3b", 2.0, 20).build());
            store.record(call("qwen2.5:3b", 1.0, 0).success(false).errorType("server_error").build());

            Map<String, ModelStats> comparison = store.getModelComparison();

            ModelStats qwen = comparison.get("qwen2.5:3b");
            assertThat(qwen.getSuccessRate()).isEqualTo(50.0);
            assertThat(qwen.getAvgDurationSeconds()).isEqualTo(2.0);
            assertThat(qwen.getErrorBreakdown()).containsEntry("server_error", 1);
        }

        @Test
        void pagesEntriesNewestFirst() {
            store.initialize();
            MetricsEntry first = store.record(call("m", 1.0, 1).build());
            clock.advance(Duration.ofSeconds(1));
            MetricsEntry second = store.record(call("m", 1.0, 2).build());
            clock.advance(Duration.ofSeconds(1));
            MetricsEntry third = store.record(call("m", 1.0, 3).build());

            assertThat(store.getEntries(2, 0)).containsExactly(third, second);
            assertThat(store.getEntries(2, 2)).containsExactly(first);
            assertThat(store.getEntries(2, 5)).isEmpty();
        }
    }

    @Nested
    @DisplayName("system metrics window")
    class SystemWindow {

        @Test
        void historyReturnsRecentPointsOldestFirst() {
            store.initialize();
            store.sampleSystemMetrics();
            clock.advance(Duration.ofMinutes(20));
            store.sampleSystemMetrics();
            clock.advance(Duration.ofMinutes(5));
            store.sampleSystemMetrics();

            List<SystemMetricsPoint> history = store.getSystemMetricsHistory(15);

            assertThat(history).hasSize(2);
            assertThat(history.get(0).getTimestamp()).isBefore(history.get(1).getTimestamp());
        }

        @Test
        void unavailableSensorsBecomeNull() {
            collector.temperature = null;
            collector.cpuPercent = null;
            store.initialize();

            store.sampleSystemMetrics();

            SystemMetricsPoint point = store.getSystemMetricsHistory(5).get(0);
            assertThat(point.getTemperatureC()).isNull();
            assertThat(point.getCpuPercent()).isNull();
            assertThat(point.getMemoryMb()).isEqualTo(2048.0);
        }

        @Test
        void prunesPointsOlderThanMaxAge() {
            store.initialize();
            store.sampleSystemMetrics();
            clock.advance(Duration.ofHours(25));
            store.sampleSystemMetrics();

            assertThat(store.getSystemMetricsHistory(1440)).hasSize(1);
        }

        @Test
        void savesEveryNthSampleAndFlushesOnShutdown() throws Exception {
            Path file = tempDir.resolve("system_metrics.json");
            store.initialize();
            store.sampleSystemMetrics();
            store.sampleSystemMetrics();
            assertThat(Files.exists(file)).isFalse();

            store.sampleSystemMetrics();
            assertThat(Files.exists(file)).isTrue();

            store.sampleSystemMetrics();
            store.shutdown();

            store = newStore();
            store.initialize();
            assertThat(store.getSystemMetricsHistory(60)).hasSize(4);
        }
    }
}
