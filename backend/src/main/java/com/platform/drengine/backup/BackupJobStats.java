package com.platform.drengine.backup;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Running statistics of a backup job, updated once per finalized execution.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BackupJobStats {
    
    private long totalExecutions;
    
    private long successfulExecutions;
    
    private long failedExecutions;
    
    private int consecutiveFailures;
    
    private long averageDurationMs;
    
    private long averageSizeBytes;
    
    private Instant lastSuccessAt;
    
    private Instant lastRunAt;
    
    private String lastError;
    
    public static BackupJobStats empty() {
        return new BackupJobStats();
    }
    
    public BackupJobStats withSuccess(Duration duration, long storedBytes, Instant finishedAt) {
        long successes = successfulExecutions + 1;
        return toBuilder()
            .totalExecutions(totalExecutions + 1)
            .successfulExecutions(successes)
            .consecutiveFailures(0)
            .averageDurationMs(runningAverage(averageDurationMs, duration.toMillis(), successes))
            .averageSizeBytes(runningAverage(averageSizeBytes, storedBytes, successes))
            .lastSuccessAt(finishedAt)
            .lastRunAt(finishedAt)
            .build();
    }
    
    public BackupJobStats withFailure(String error, Instant finishedAt) {
        return toBuilder()
            .totalExecutions(totalExecutions + 1)
            .failedExecutions(failedExecutions + 1)
            .consecutiveFailures(consecutiveFailures + 1)
            .lastRunAt(finishedAt)
            .lastError(error)
            .build();
    }
    
    public double successRate() {
        return totalExecutions == 0 ? 0.0 : (double) successfulExecutions / totalExecutions;
    }
    
    private static long runningAverage(long average, long sample, long count) {
        return average + (sample - average) / count;
    }
}
