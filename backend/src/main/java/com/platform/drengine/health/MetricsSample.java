package com.platform.drengine.health;

import java.util.Objects;
import java.util.stream.Stream;

/**
 * Raw numbers from the metrics source. Any value may be null when the source has no data.
 */
public record MetricsSample(
    Long activeConnections,
    Double cpuPercent,
    Double memoryPercent,
    Double diskPercent
) {
    public static MetricsSample unavailable() {
        return new MetricsSample(null, null, null, null);
    }
    
    /**
     * Highest of disk, CPU and memory utilisation, or null when none is known.
     */
    public Double saturationPercent() {
        return Stream.of(cpuPercent, memoryPercent, diskPercent)
            .filter(Objects::nonNull)
            .max(Double::compare)
            .orElse(null);
    }
}
