package com.platform.drengine.health;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Immutable point-in-time health evaluation of a primary region.
 * Null measurements mean the value was unknown when the snapshot was taken.
 */
public record HealthSnapshot(
    UUID id,
    String primaryRegion,
    Instant capturedAt,
    Long activeConnections,
    Duration maxReplicationLag,
    Double saturationPercent,
    int failedBackupsLast24h,
    int consecutiveBackupFailures,
    List<Indicator> indicators,
    Severity severity,
    boolean failoverRecommended,
    List<String> notes
) {
    public HealthSnapshot {
        indicators = indicators == null ? List.of() : List.copyOf(indicators);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
    
    public long raisedIndicators() {
        return indicators.stream().filter(Indicator::isRaised).count();
    }
}
