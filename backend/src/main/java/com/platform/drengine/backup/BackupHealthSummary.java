package com.platform.drengine.backup;

/**
 * Backup failure signals of one source region, as read by the health monitor.
 */
public record BackupHealthSummary(
    String sourceRegion,
    int jobs,
    int maxConsecutiveFailures,
    int failuresLast24h,
    int executionsLast24h
) {
}
