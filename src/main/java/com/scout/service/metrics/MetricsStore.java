package com.scout.service.metrics;

import com.scout.config.ScoutProperties;
import com.scout.exception.MetricsInitializationException;
import com.scout.exception.MetricsPersistenceException;
import com.scout.model.metrics.MetricsEntry;
import com.scout.model.metrics.ModelStats;
import com.scout.model.metrics.PerformanceStatus;
import com.scout.model.metrics.PerformanceSummary;
import com.scout.model.metrics.PerformanceTrend;
import com.scout.model.metrics.RecordRequest;
import com.scout.model.metrics.SystemMetricsPoint;
import com.scout.model.metrics.SystemMetricsSeries;
import com.scout.model.metrics.SystemSnapshot;
import com.scout.repository.MetricsFileRepository;
import com.scout.service.metrics.collector.SystemCollector;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Records one entry per inference attempt and derives statistics from them.
 *
 * <p>Entries of the current month live in memory and are persisted as a monthly
 * shard after every append. Entries older than the retention window are moved to
 * {@code archive/} shards. A background sampler keeps a rolling, age-bounded
 * window of host health points.
 *
 * <p>All state is guarded by a single lock. Persistence failures are logged and
 * never propagate out of {@link #record(RecordRequest)}.
 */
@Slf4j
public class MetricsStore {

    private static final Duration SAMPLER_STOP_TIMEOUT = Duration.ofSeconds(5);
    private static final double TREND_THRESHOLD_PERCENT = 10.0;
    private static final int MAX_HISTORY_MINUTES = 1440;

    private final MetricsFileRepository repository;
    private final SystemCollector systemCollector;
    private final ScoutProperties.MetricsConfig config;
    private final Clock clock;
    private final ZoneId zone;
    private final Object lock = new Object();

    private final List<MetricsEntry> entries = new ArrayList<>();
    private final List<SystemMetricsPoint> systemPoints = new ArrayList<>();
    private YearMonth currentMonth;
    private int samplesSinceSave;
    private boolean initialized;
    private SystemMetricsSampler sampler;

    public MetricsStore(MetricsFileRepository repository,
                        SystemCollector systemCollector,
                        ScoutProperties.MetricsConfig config,
                        Clock clock) {
        this.repository = repository;
        this.systemCollector = systemCollector;
        this.config = config;
        this.clock = clock;
        this.zone = clock.getZone();
    }

    /**
     * Create directories, archive entries past retention, load the current shard and the
     * system window, then start the sampler.
     *
     * @throws MetricsInitializationException if the metrics directory is unusable
     */
    public void initialize() {
        synchronized (lock) {
            if (initialized) {
                log.warn("Metrics store already initialized");
                return;
            }

            try {
                repository.createDirectories();
                currentMonth = YearMonth.now(clock);
                archiveOnDisk();
                entries.clear();
                entries.addAll(readQuietly(() -> repository.readActive(currentMonth), "current shard"));
                loadSystemMetrics();
                initialized = true;
            } catch (IOException | RuntimeException e) {
                String message = "Failed to initialize metrics store: " + e.getMessage();
                log.error(message);
                throw new MetricsInitializationException(message, e);
            }

            log.info("Metrics store initialized with {} entries, {} system metrics points",
                    entries.size(), systemPoints.size());
        }

        if (config.isSystemMetricsEnabled()) {
            sampler = new SystemMetricsSampler(config.getSystemMetricsInterval(), this::sampleSystemMetrics);
            sampler.start();
        }
    }

    /**
     * Stop the sampler, wait for it, then flush the system window and the current shard.
     */
    public void shutdown() {
        if (sampler != null) {
            sampler.stop(SAMPLER_STOP_TIMEOUT);
            sampler = null;
        }

        synchronized (lock) {
            if (!initialized) {
                return;
            }
            persistCurrentMonth();
            saveSystemMetrics();
            initialized = false;
            log.info("Metrics store shut down");
        }
    }

    /**
     * Append one entry for an inference attempt.
     *
     * @return the recorded entry, also when it could not be persisted
     */
    public MetricsEntry record(RecordRequest request) {
        request.validate();

        synchronized (lock) {
            ensureInitialized();

            SystemSnapshot snapshot = captureSnapshot();
            MetricsEntry entry = MetricsEntry.builder()
                    .id(UUID.randomUUID().toString())
                    .timestamp(clock.instant())
                    .model(request.getModel())
                    .module(request.getModule())
                    .jobId(request.getJobId())
                    .durationSeconds(request.getDurationSeconds())
                    .promptTokens(request.getPromptTokens())
                    .completionTokens(request.getCompletionTokens())
                    .success(request.isSuccess())
                    .errorType(request.getErrorType())
                    .retryCount(request.getRetryCount())
                    .fallbackUsed(request.isFallbackUsed())
                    .cpuPercent(snapshot.getCpuPercent())
                    .memoryMb(snapshot.getMemoryMb())
                    .temperatureC(snapshot.getTemperatureC())
                    .build();

            YearMonth entryMonth = YearMonth.from(entry.getTimestamp().atZone(zone));
            if (!entryMonth.equals(currentMonth)) {
                rollOver(entryMonth);
            }

            entries.add(entry);
            persistCurrentMonth();

            log.info("Recorded metrics: {} ({} tokens in {}s = {} tok/s) {}",
                    entry.getModel(),
                    entry.getCompletionTokens(),
                    String.format("%.2f", entry.getDurationSeconds()),
                    String.format("%.1f", entry.getTokensPerSecond()),
                    entry.isSuccess() ? "OK" : "FAIL: " + entry.getErrorType());

            return entry;
        }
    }

    public PerformanceStatus getStatus() {
        synchronized (lock) {
            ensureInitialized();

            LocalDate today = LocalDate.now(clock);
            List<MetricsEntry> todayEntries = entries.stream()
                    .filter(e -> e.getTimestamp().atZone(zone).toLocalDate().equals(today))
                    .collect(Collectors.toList());

            int callsToday = todayEntries.size();
            long successfulToday = todayEntries.stream().filter(MetricsEntry::isSuccess).count();
            List<MetricsEntry> primaryEntries = todayEntries.stream()
                    .filter(e -> !e.isFallbackUsed())
                    .collect(Collectors.toList());
            long primarySuccessful = primaryEntries.stream().filter(MetricsEntry::isSuccess).count();
            long fallbackCalls = callsToday - primaryEntries.size();

            PerformanceStatus.PerformanceStatusBuilder status = PerformanceStatus.builder()
                    .callsToday(callsToday)
                    .successRateToday(MetricsCalculator.percentage(successfulToday, callsToday))
                    .avgTokensPerSecond(MetricsCalculator.averageTokensPerSecond(todayEntries))
                    .avgDurationSeconds(MetricsCalculator.mean(MetricsCalculator.successfulDurations(todayEntries)))
                    .primaryModelSuccessRate(MetricsCalculator.percentage(primarySuccessful, primaryEntries.size()))
                    .fallbackUsageRate(MetricsCalculator.percentage(fallbackCalls, callsToday))
                    .performanceTrend(calculateTrend(clock.instant()));

            if (config.isSystemMetricsEnabled()) {
                Double temperature = systemCollector.getTemperature();
                status.currentCpuPercent(systemCollector.getCpuPercent())
                        .currentMemoryPercent(systemCollector.getMemoryPercent())
                        .currentTemperature(temperature)
                        .throttlingWarning(temperature != null && temperature >= SystemCollector.THROTTLING_THRESHOLD_C);
            }

            return status.build();
        }
    }

    /**
     * Statistics over {@code [start, end]}. Defaults: start of the current month, now.
     * Months other than the current one are read from their active and archive shards.
     */
    public PerformanceSummary getSummary(Instant start, Instant end) {
        synchronized (lock) {
            ensureInitialized();

            Instant periodStart = start != null ? start : currentMonth.atDay(1).atStartOfDay(zone).toInstant();
            Instant periodEnd = end != null ? end : clock.instant();

            List<MetricsEntry> period = entriesBetween(periodStart, periodEnd);

            PerformanceSummary.PerformanceSummaryBuilder summary = PerformanceSummary.builder()
                    .periodStart(periodStart)
                    .periodEnd(periodEnd);

            if (period.isEmpty()) {
                return summary.build();
            }

            int totalCalls = period.size();
            int successfulCalls = (int) period.stream().filter(MetricsEntry::isSuccess).count();
            List<Double> durations = MetricsCalculator.successfulDurations(period);
            long fallbackCalls = period.stream().filter(MetricsEntry::isFallbackUsed).count();

            return summary
                    .totalCalls(totalCalls)
                    .totalTokens(period.stream().mapToLong(MetricsEntry::getTotalTokens).sum())
                    .successfulCalls(successfulCalls)
                    .avgTokensPerSecond(MetricsCalculator.averageTokensPerSecond(period))
                    .medianDurationSeconds(MetricsCalculator.median(durations))
                    .p95DurationSeconds(MetricsCalculator.p95(durations))
                    .successRate(MetricsCalculator.percentage(successfulCalls, totalCalls))
                    .errorBreakdown(MetricsCalculator.errorBreakdown(period))
                    .fallbackRate(MetricsCalculator.percentage(fallbackCalls, totalCalls))
                    .modelStats(MetricsCalculator.modelStats(period))
                    .moduleStats(MetricsCalculator.moduleStats(period))
                    .avgCpuPercent(MetricsCalculator.meanOrNull(collectNonNull(period, MetricsEntry::getCpuPercent)))
                    .avgMemoryMb(MetricsCalculator.meanOrNull(collectNonNull(period, MetricsEntry::getMemoryMb)))
                    .avgTemperatureC(MetricsCalculator.meanOrNull(collectNonNull(period, MetricsEntry::getTemperatureC)))
                    .build();
        }
    }

    /**
     * Per-model statistics for the current month.
     */
    public Map<String, ModelStats> getModelComparison() {
        synchronized (lock) {
            ensureInitialized();
            return MetricsCalculator.modelStats(entries);
        }
    }

    /**
     * Newest-first page of the current month's entries.
     */
    public List<MetricsEntry> getEntries(int limit, int offset) {
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be at least 1, got " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative, got " + offset);
        }

        synchronized (lock) {
            ensureInitialized();
            List<MetricsEntry> page = new ArrayList<>();
            for (int i = entries.size() - 1 - offset; i >= 0 && page.size() < limit; i--) {
                page.add(entries.get(i));
            }
            return page;
        }
    }

    /**
     * System points from the last {@code minutes} (clamped to 1..1440), oldest first.
     */
    public List<SystemMetricsPoint> getSystemMetricsHistory(int minutes) {
        int window = Math.max(1, Math.min(minutes, MAX_HISTORY_MINUTES));
        synchronized (lock) {
            ensureInitialized();
            Instant cutoff = clock.instant().minus(Duration.ofMinutes(window));
            return systemPoints.stream()
                    .filter(p -> !p.getTimestamp().isBefore(cutoff))
                    .sorted(Comparator.comparing(SystemMetricsPoint::getTimestamp))
                    .collect(Collectors.toList());
        }
    }

    /**
     * Move entries older than the retention window into archive shards.
     *
     * @return number of entries archived
     */
    public int archiveOldEntries() {
        synchronized (lock) {
            ensureInitialized();
            persistCurrentMonth();
            int archived = archiveOnDisk();
            if (archived > 0) {
                entries.clear();
                entries.addAll(readQuietly(() -> repository.readActive(currentMonth), "current shard"));
            }
            return archived;
        }
    }

    /**
     * Take one system sample, prune the window by age and persist every N samples.
     */
    public void sampleSystemMetrics() {
        SystemMetricsPoint point = SystemMetricsPoint.builder()
                .timestamp(clock.instant())
                .cpuPercent(systemCollector.getCpuPercent())
                .memoryPercent(systemCollector.getMemoryPercent())
                .memoryMb(systemCollector.getMemoryMb())
                .temperatureC(systemCollector.getTemperature())
                .build();

        synchronized (lock) {
            if (!initialized) {
                return;
            }
            systemPoints.add(point);
            pruneSystemMetrics();

            samplesSinceSave++;
            if (samplesSinceSave >= config.getSystemMetricsSaveEvery()) {
                saveSystemMetrics();
                samplesSinceSave = 0;
            }
        }
    }

    public boolean isInitialized() {
        synchronized (lock) {
            return initialized;
        }
    }

    private void rollOver(YearMonth newMonth) {
        persistCurrentMonth();
        log.info("Metrics month rollover: {} -> {}", currentMonth, newMonth);
        currentMonth = newMonth;
        entries.clear();
        entries.addAll(readQuietly(() -> repository.readActive(newMonth), "shard " + newMonth));
    }

    private int archiveOnDisk() {
        LocalDate cutoff = LocalDate.now(clock).minusDays(config.getRetentionDays());
        int archived = 0;

        for (YearMonth month : repository.listActiveMonths()) {
            List<MetricsEntry> shard;
            try {
                shard = repository.readActive(month);
            } catch (MetricsPersistenceException e) {
                log.warn("Skipping unreadable shard {} during archival: {}", month, e.getMessage());
                continue;
            }

            List<MetricsEntry> old = new ArrayList<>();
            List<MetricsEntry> kept = new ArrayList<>();
            for (MetricsEntry entry : shard) {
                if (entry.getTimestamp().atZone(zone).toLocalDate().isBefore(cutoff)) {
                    old.add(entry);
                } else {
                    kept.add(entry);
                }
            }

            if (old.isEmpty()) {
                continue;
            }

            Map<YearMonth, List<MetricsEntry>> byMonth = old.stream()
                    .collect(Collectors.groupingBy(e -> YearMonth.from(e.getTimestamp().atZone(zone)),
                            LinkedHashMap::new, Collectors.toList()));
            // archive first: a crash before the active rewrite is repaired by de-duplication
            byMonth.forEach(this::appendToArchive);

            if (kept.isEmpty() && !month.equals(currentMonth)) {
                repository.deleteActive(month);
            } else {
                repository.writeActive(month, kept);
            }
            archived += old.size();
        }

        if (archived > 0) {
            log.info("Archived {} entries older than {}", archived, cutoff);
        }
        return archived;
    }

    private void appendToArchive(YearMonth month, List<MetricsEntry> newEntries) {
        List<MetricsEntry> merged = new ArrayList<>(readQuietly(() -> repository.readArchive(month), "archive " + month));
        Set<String> seen = merged.stream().map(MetricsStore::identity).collect(Collectors.toCollection(HashSet::new));

        int added = 0;
        for (MetricsEntry entry : newEntries) {
            if (seen.add(identity(entry))) {
                merged.add(entry);
                added++;
            }
        }

        repository.writeArchive(month, merged, clock.instant());
        log.info("Archived {} entries to {}", added, repository.archiveFile(month));
    }

    private List<MetricsEntry> entriesBetween(Instant start, Instant end) {
        List<MetricsEntry> source = new ArrayList<>(entries);
        Set<String> seen = source.stream().map(MetricsStore::identity).collect(Collectors.toCollection(HashSet::new));

        YearMonth first = YearMonth.from(start.atZone(zone));
        YearMonth last = YearMonth.from(end.atZone(zone));
        for (YearMonth month = first; !month.isAfter(last); month = month.plusMonths(1)) {
            YearMonth shardMonth = month;
            if (!shardMonth.equals(currentMonth)) {
                addUnseen(source, seen, readQuietly(() -> repository.readActive(shardMonth), "shard " + shardMonth));
            }
            addUnseen(source, seen, readQuietly(() -> repository.readArchive(shardMonth), "archive " + shardMonth));
        }

        return source.stream()
                .filter(e -> !e.getTimestamp().isBefore(start) && !e.getTimestamp().isAfter(end))
                .collect(Collectors.toList());
    }

    private PerformanceTrend calculateTrend(Instant now) {
        Instant oneHourAgo = now.minus(Duration.ofHours(1));
        Instant twoHoursAgo = now.minus(Duration.ofHours(2));

        List<MetricsEntry> lastHour = entries.stream()
                .filter(MetricsEntry::isSuccess)
                .filter(e -> !e.getTimestamp().isBefore(oneHourAgo) && !e.getTimestamp().isAfter(now))
                .collect(Collectors.toList());
        List<MetricsEntry> previousHour = entries.stream()
                .filter(MetricsEntry::isSuccess)
                .filter(e -> !e.getTimestamp().isBefore(twoHoursAgo) && e.getTimestamp().isBefore(oneHourAgo))
                .collect(Collectors.toList());

        if (lastHour.isEmpty() || previousHour.isEmpty()) {
            return PerformanceTrend.STABLE;
        }

        double lastTps = MetricsCalculator.averageTokensPerSecond(lastHour);
        double previousTps = MetricsCalculator.averageTokensPerSecond(previousHour);
        if (previousTps == 0.0) {
            return PerformanceTrend.STABLE;
        }

        double changePercent = (lastTps - previousTps) / previousTps * 100.0;
        if (changePercent >= TREND_THRESHOLD_PERCENT) {
            return PerformanceTrend.IMPROVING;
        } else if (changePercent <= -TREND_THRESHOLD_PERCENT) {
            return PerformanceTrend.DEGRADING;
        }
        return PerformanceTrend.STABLE;
    }

    private SystemSnapshot captureSnapshot() {
        if (!config.isSystemMetricsEnabled()) {
            return SystemSnapshot.empty();
        }
        try {
            return systemCollector.snapshot();
        } catch (RuntimeException e) {
            log.warn("System snapshot unavailable: {}", e.getMessage());
            return SystemSnapshot.empty();
        }
    }

    private void loadSystemMetrics() {
        try {
            repository.readSystemMetrics().ifPresent(series -> {
                systemPoints.clear();
                systemPoints.addAll(series.getPoints());
            });
        } catch (MetricsPersistenceException e) {
            log.error("Error loading system metrics file, starting empty: {}", e.getMessage());
        }
        pruneSystemMetrics();
        log.debug("Loaded {} system metrics points", systemPoints.size());
    }

    private void pruneSystemMetrics() {
        Instant cutoff = clock.instant().minus(config.getSystemMetricsMaxAge());
        systemPoints.removeIf(p -> p.getTimestamp().isBefore(cutoff));
    }

    private void saveSystemMetrics() {
        SystemMetricsSeries series = SystemMetricsSeries.builder()
                .updatedAt(clock.instant())
                .intervalSeconds(config.getSystemMetricsInterval().toSeconds())
                .maxAgeHours(config.getSystemMetricsMaxAge().toHours())
                .points(new ArrayList<>(systemPoints))
                .build();
        try {
            repository.writeSystemMetrics(series);
            log.debug("Saved {} system metrics points", systemPoints.size());
        } catch (MetricsPersistenceException e) {
            log.error("Error saving system metrics file", e);
        }
    }

    private void persistCurrentMonth() {
        if (currentMonth == null) {
            return;
        }
        try {
            repository.writeActive(currentMonth, entries);
        } catch (MetricsPersistenceException e) {
            log.error("Error saving metrics shard {}", currentMonth, e);
        }
    }

    private <T> List<T> readQuietly(Supplier<List<T>> reader, String what) {
        try {
            return reader.get();
        } catch (MetricsPersistenceException e) {
            log.error("Error loading metrics {}: {}", what, e.getMessage());
            return new ArrayList<>();
        }
    }

    private static void addUnseen(List<MetricsEntry> target, Set<String> seen, List<MetricsEntry> candidates) {
        for (MetricsEntry entry : candidates) {
            if (seen.add(identity(entry))) {
                target.add(entry);
            }
        }
    }

    private static List<Double> collectNonNull(List<MetricsEntry> period,
                                               Function<MetricsEntry, Double> field) {
        return period.stream().map(field).filter(Objects::nonNull).collect(Collectors.toList());
    }

    /**
     * Entries written before ids existed fall back to a content key.
     */
    private static String identity(MetricsEntry entry) {
        if (entry.getId() != null) {
            return entry.getId();
        }
        return entry.getTimestamp() + "|" + entry.getModel() + "|" + entry.getRetryCount() + "|" + entry.getDurationSeconds();
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Metrics store not initialized. Call initialize() first.");
        }
    }
}
