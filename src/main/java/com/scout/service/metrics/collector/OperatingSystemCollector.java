package com.scout.service.metrics.collector;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads CPU and memory from the platform MXBean and temperature from sysfs.
 */
@Slf4j
public class OperatingSystemCollector implements SystemCollector {

    static final List<Path> DEFAULT_THERMAL_PATHS = List.of(
            Path.of("/sys/class/thermal/thermal_zone0/temp"),
            Path.of("/sys/class/hwmon/hwmon0/temp1_input")
    );

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final com.sun.management.OperatingSystemMXBean osBean;
    private final Path thermalPath;

    public OperatingSystemCollector() {
        this(DEFAULT_THERMAL_PATHS);
    }

    public OperatingSystemCollector(List<Path> thermalPaths) {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean mx) {
            this.osBean = mx;
        } else {
            log.warn("Extended OperatingSystemMXBean not available, CPU/memory metrics disabled");
            this.osBean = null;
        }

        this.thermalPath = thermalPaths.stream()
                .filter(Files::isReadable)
                .findFirst()
                .orElse(null);

        if (thermalPath != null) {
            log.debug("Found thermal sensor at {}", thermalPath);
        } else {
            log.debug("No thermal sensor found, temperature metrics disabled");
        }
    }

    @Override
    public Double getCpuPercent() {
        if (osBean == null) {
            return null;
        }
        try {
            double load = osBean.getCpuLoad();
            // negative until the first sample is available
            return load < 0 ? null : load * 100.0;
        } catch (RuntimeException e) {
            log.warn("Failed to get CPU percent: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public Double getMemoryPercent() {
        if (osBean == null) {
            return null;
        }
        try {
            long total = osBean.getTotalMemorySize();
            if (total <= 0) {
                return null;
            }
            return (total - osBean.getFreeMemorySize()) * 100.0 / total;
        } catch (RuntimeException e) {
            log.warn("Failed to get memory percent: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public Double getMemoryMb() {
        if (osBean == null) {
            return null;
        }
        try {
            return (osBean.getTotalMemorySize() - osBean.getFreeMemorySize()) / BYTES_PER_MB;
        } catch (RuntimeException e) {
            log.warn("Failed to get memory usage: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Sysfs reports millidegrees Celsius.
     */
    @Override
    public Double getTemperature() {
        if (thermalPath == null) {
            return null;
        }
        try {
            String raw = Files.readString(thermalPath).trim();
            return Long.parseLong(raw) / 1000.0;
        } catch (IOException | NumberFormatException e) {
            log.debug("Failed to read thermal sensor {}: {}", thermalPath, e.getMessage());
            return null;
        }
    }
}
