package com.platform.drengine.backup;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Scheduled backup definition. Only {@code nextExecution} and {@code stats} change after creation,
 * apart from deactivation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BackupJob {
    
    private UUID id;
    
    private String name;
    
    private BackupType type;
    
    /**
     * Spring cron expression, evaluated in UTC.
     */
    private String schedule;
    
    private String sourceRegion;
    
    private BackupScope scope;
    
    private String storagePrefix;
    
    private int retentionDays;
    
    /**
     * When false the job runs only while holding the exclusive slot shared by all non-parallel jobs.
     */
    private boolean allowParallel;
    
    private BackupPriority priority;
    
    private CompressionLevel compression;
    
    private boolean verifyAfterWrite;
    
    private boolean active;
    
    private String configurationScope;
    
    private Instant nextExecution;
    
    private Instant createdAt;
    
    @Builder.Default
    private BackupJobStats stats = BackupJobStats.empty();
    
    /**
     * Jobs sharing a source region and scope back up the same data and form one restore lineage.
     */
    public boolean sameLineage(BackupJob other) {
        return other != null
            && sourceRegion.equals(other.sourceRegion)
            && scope.equals(other.scope);
    }
}
