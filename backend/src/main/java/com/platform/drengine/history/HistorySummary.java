package com.platform.drengine.history;

import com.platform.drengine.failover.FailoverOutcome;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Aggregated DR history of a scope over a time window, as read by the compliance reporter.
 * Rates are null when the window holds nothing to rate.
 */
public record HistorySummary(
    String configurationScope,
    Instant from,
    Instant to,
    Backups backups,
    Failovers failovers,
    RecoveryTests recoveryTests
) {
    
    public record Backups(long executions, long successful, long failed, long recoveryTested, Double successRate) {
    }
    
    public record Failovers(long events, Map<FailoverOutcome, Long> outcomes, long inProgress, Duration averageDuration) {
    }
    
    public record RecoveryTests(long completed, long passed, long failed, Double passRate) {
    }
}
