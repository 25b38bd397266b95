package com.scout.service.metrics;

import com.scout.model.metrics.MetricsEntry;
import com.scout.model.metrics.ModelStats;
import com.scout.model.metrics.ModuleStats;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Aggregations over metrics entries.
 */
final class MetricsCalculator {

    static final String UNKNOWN_MODULE = "unknown";

    private MetricsCalculator() {
    }

    static double mean(Collection<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    static Double meanOrNull(Collection<Double> values) {
        return values.isEmpty() ? null : mean(values);
    }

    static double median(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int mid = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(mid);
        }
        return (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
    }

    /**
     * Nearest-rank 95th percentile: index {@code floor(n * 0.95)}, clamped to the last element.
     */
    static double p95(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int index = (int) (sorted.size() * 0.95);
        return sorted.get(Math.min(index, sorted.size() - 1));
    }

    static double percentage(long part, long total) {
        return total == 0 ? 0.0 : (part * 100.0) / total;
    }

    /**
     * Mean output tokens per second over successful entries with a positive duration.
     */
    static double averageTokensPerSecond(Collection<MetricsEntry> entries) {
        return mean(entries.stream()
                .filter(MetricsEntry::isSuccess)
                .filter(e -> e.getDurationSeconds() > 0)
                .map(MetricsEntry::getTokensPerSecond)
                .collect(Collectors.toList()));
    }

    static List<Double> successfulDurations(Collection<MetricsEntry> entries) {
        return entries.stream()
                .filter(MetricsEntry::isSuccess)
                .map(MetricsEntry::getDurationSeconds)
                .collect(Collectors.toList());
    }

    static Map<String, Integer> errorBreakdown(Collection<MetricsEntry> entries) {
        Map<String, Integer> breakdown = new TreeMap<>();
        for (MetricsEntry entry : entries) {
            if (!entry.isSuccess() && entry.getErrorType() != null) {
                breakdown.merge(entry.getErrorType(), 1, Integer::sum);
            }
        }
        return breakdown;
    }

    static Map<String, ModelStats> modelStats(Collection<MetricsEntry> entries) {
        Map<String, List<MetricsEntry>> byModel = entries.stream()
                .collect(Collectors.groupingBy(MetricsEntry::getModel, TreeMap::new, Collectors.toList()));

        Map<String, ModelStats> stats = new LinkedHashMap<>();
        byModel.forEach((model, list) -> stats.put(model, ModelStats.builder()
                .modelName(model)
                .totalCalls(list.size())
                .successCount((int) list.stream().filter(MetricsEntry::isSuccess).count())
                .totalTokens(list.stream().mapToLong(MetricsEntry::getTotalTokens).sum())
                .totalDurationSeconds(successfulDurations(list).stream().mapToDouble(Double::doubleValue).sum())
                .avgTokensPerSecond(averageTokensPerSecond(list))
                .errorBreakdown(errorBreakdown(list))
                .build()));
        return stats;
    }

    static Map<String, ModuleStats> moduleStats(Collection<MetricsEntry> entries) {
        Map<String, List<MetricsEntry>> byModule = entries.stream()
                .collect(Collectors.groupingBy(e -> Objects.requireNonNullElse(e.getModule(), UNKNOWN_MODULE),
                        TreeMap::new, Collectors.toList()));

        Map<String, ModuleStats> stats = new LinkedHashMap<>();
        byModule.forEach((module, list) -> stats.put(module, ModuleStats.builder()
                .moduleName(module)
                .totalCalls(list.size())
                .successCount((int) list.stream().filter(MetricsEntry::isSuccess).count())
                .totalDurationSeconds(successfulDurations(list).stream().mapToDouble(Double::doubleValue).sum())
                .avgTokensPerSecond(averageTokensPerSecond(list))
                .build()));
        return stats;
    }
}
