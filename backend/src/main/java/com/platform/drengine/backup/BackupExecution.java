package com.platform.drengine.backup;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * One run of a backup job. Finalized exactly once; immutable afterwards except for the
 * recovery-tested flag set by recovery tests.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BackupExecution {
    
    private UUID id;
    
    private UUID jobId;
    
    private BackupType requestedType;
    
    /**
     * Type actually taken. An incremental without any successful full becomes FULL.
     */
    private BackupType effectiveType;
    
    private ExecutionStatus status;
    
    private Instant startedAt;
    
    private Instant completedAt;
    
    /**
     * Lower bound of the captured change window, null for full backups.
     */
    private Instant baselineAt;
    
    private long rawSizeBytes;
    
    private long storedSizeBytes;
    
    private long recordCount;
    
    private List<String> tablesBackedUp;
    
    private Instant latestChangeAt;
    
    private String storageKey;
    
    private String checksum;
    
    @Builder.Default
    private VerificationState verification = VerificationState.NOT_VERIFIED;
    
    private boolean recoveryTested;
    
    private String errorDetail;
    
    public boolean isSuccessful() {
        return status == ExecutionStatus.COMPLETED;
    }
    
    public double compressionRatio() {
        return storedSizeBytes == 0 ? 0.0 : (double) rawSizeBytes / storedSizeBytes;
    }
    
    public Duration duration() {
        return startedAt == null || completedAt == null ? Duration.ZERO : Duration.between(startedAt, completedAt);
    }
}
