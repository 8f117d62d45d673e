package com.platform.drengine.persistence.entity;

import com.platform.drengine.backup.BackupPriority;
import com.platform.drengine.backup.BackupType;
import com.platform.drengine.backup.CompressionLevel;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for backup jobs. Scope and statistics are stored as JSON.
 */
@Entity
@Table(name = "backup_jobs", indexes = {
    @Index(name = "idx_backup_job_due", columnList = "active, next_execution"),
    @Index(name = "idx_backup_job_region", columnList = "source_region")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackupJobEntity {
    
    @Id
    @Column(length = 36)
    private String id;
    
    @Column(nullable = false)
    private String name;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "type", columnDefinition = "VARCHAR(20)", nullable = false)
    private BackupType type;
    
    @Column(nullable = false, length = 100)
    private String schedule;
    
    @Column(name = "source_region", length = 100, nullable = false)
    private String sourceRegion;
    
    @Column(name = "scope_json", columnDefinition = "JSON", nullable = false)
    private String scopeJson;
    
    @Column(name = "storage_prefix", nullable = false)
    private String storagePrefix;
    
    @Column(name = "retention_days", nullable = false)
    private int retentionDays;
    
    @Column(name = "allow_parallel", nullable = false)
    private boolean allowParallel;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "priority", columnDefinition = "VARCHAR(20)", nullable = false)
    private BackupPriority priority;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "compression", columnDefinition = "VARCHAR(20)", nullable = false)
    private CompressionLevel compression;
    
    @Column(name = "verify_after_write", nullable = false)
    private boolean verifyAfterWrite;
    
    @Column(nullable = false)
    private boolean active;
    
    @Column(name = "configuration_scope", length = 100, nullable = false)
    private String configurationScope;
    
    @Column(name = "next_execution")
    private Instant nextExecution;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "stats_json", columnDefinition = "JSON")
    private String statsJson;
    
    @Version
    @Column(nullable = false)
    private Long version;
}
