package com.scout.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scout.exception.MetricsPersistenceException;
import com.scout.model.metrics.MetricsEntry;
import com.scout.model.metrics.MetricsShard;
import com.scout.model.metrics.SystemMetricsSeries;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Metrics persistence layout.
 *
 * <pre>
 * {directory}/metrics_YYYY_MM.json          active shard
 * {directory}/archive/metrics_YYYY_MM.json  archive shard
 * {directory}/system_metrics.json           rolling system window
 * </pre>
 *
 * Every write goes through {@link AtomicFiles}.
 */
@Slf4j
public class MetricsFileRepository {

    private static final String ARCHIVE_DIR = "archive";
    private static final String SYSTEM_METRICS_FILE = "system_metrics.json";
    private static final Pattern SHARD_NAME = Pattern.compile("metrics_(\\d{4})_(\\d{2})\\.json");

    private final Path directory;
    private final ObjectMapper objectMapper;

    public MetricsFileRepository(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    public Path getDirectory() {
        return directory;
    }

    public void createDirectories() throws IOException {
        Files.createDirectories(directory);
        Files.createDirectories(archiveDirectory());
    }

    public Path activeFile(YearMonth month) {
        return directory.resolve(shardName(month));
    }

    public Path archiveFile(YearMonth month) {
        return archiveDirectory().resolve(shardName(month));
    }

    public List<YearMonth> listActiveMonths() {
        return listMonths(directory);
    }

    public List<YearMonth> listArchiveMonths() {
        return listMonths(archiveDirectory());
    }

    /**
     * Entries of an active shard, empty when the shard does not exist.
     *
     * @throws MetricsPersistenceException if the shard cannot be read or parsed
     */
    public List<MetricsEntry> readActive(YearMonth month) {
        return readShard(activeFile(month))
                .map(MetricsShard::getEntries)
                .orElseGet(ArrayList::new);
    }

    public List<MetricsEntry> readArchive(YearMonth month) {
        return readShard(archiveFile(month))
                .map(MetricsShard::getEntries)
                .orElseGet(ArrayList::new);
    }

    public void writeActive(YearMonth month, List<MetricsEntry> entries) {
        MetricsShard shard = MetricsShard.builder()
                .month(month.toString())
                .entries(new ArrayList<>(entries))
                .build();
        writeFile(activeFile(month), shard);
        log.debug("Saved {} entries to {}", entries.size(), activeFile(month));
    }

    public void writeArchive(YearMonth month, List<MetricsEntry> entries, Instant archivedAt) {
        MetricsShard shard = MetricsShard.builder()
                .month(month.toString())
                .archivedAt(archivedAt)
                .entries(new ArrayList<>(entries))
                .build();
        writeFile(archiveFile(month), shard);
    }

    public void deleteActive(YearMonth month) {
        Path file = activeFile(month);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new MetricsPersistenceException("Failed to delete " + file, e);
        }
    }

    public Optional<SystemMetricsSeries> readSystemMetrics() {
        Path file = directory.resolve(SYSTEM_METRICS_FILE);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), SystemMetricsSeries.class));
        } catch (IOException e) {
            throw new MetricsPersistenceException("Failed to read " + file, e);
        }
    }

    public void writeSystemMetrics(SystemMetricsSeries series) {
        writeFile(directory.resolve(SYSTEM_METRICS_FILE), series);
    }

    private Optional<MetricsShard> readShard(Path file) {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), MetricsShard.class));
        } catch (IOException e) {
            throw new MetricsPersistenceException("Failed to read " + file, e);
        }
    }

    private void writeFile(Path file, Object value) {
        try {
            AtomicFiles.writeJson(objectMapper, file, value);
        } catch (IOException e) {
            throw new MetricsPersistenceException("Failed to write " + file, e);
        }
    }

    private Path archiveDirectory() {
        return directory.resolve(ARCHIVE_DIR);
    }

    private List<YearMonth> listMonths(Path dir) {
        List<YearMonth> months = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return months;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "metrics_*.json")) {
            for (Path file : stream) {
                Matcher matcher = SHARD_NAME.matcher(file.getFileName().toString());
                if (!matcher.matches()) {
                    continue;
                }
                try {
                    months.add(YearMonth.of(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2))));
                } catch (DateTimeException e) {
                    log.warn("Ignoring metrics file with invalid month: {}", file);
                }
            }
        } catch (IOException e) {
            throw new MetricsPersistenceException("Failed to list " + dir, e);
        }
        Collections.sort(months);
        return months;
    }

    private static String shardName(YearMonth month) {
        return String.format("metrics_%d_%02d.json", month.getYear(), month.getMonthValue());
    }
}
