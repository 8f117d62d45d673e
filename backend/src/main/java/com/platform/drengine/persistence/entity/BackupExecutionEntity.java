package com.platform.drengine.persistence.entity;

import com.platform.drengine.backup.BackupType;
import com.platform.drengine.backup.ExecutionStatus;
import com.platform.drengine.backup.VerificationState;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for backup executions.
 */
@Entity
@Table(name = "backup_executions", indexes = {
    @Index(name = "idx_backup_exec_job_started", columnList = "job_id, started_at"),
    @Index(name = "idx_backup_exec_status", columnList = "status"),
    @Index(name = "idx_backup_exec_started", columnList = "started_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackupExecutionEntity {
    
    @Id
    @Column(length = 36)
    private String id;
    
    @Column(name = "job_id", length = 36, nullable = false)
    private String jobId;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "requested_type", columnDefinition = "VARCHAR(20)", nullable = false)
    private BackupType requestedType;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "effective_type", columnDefinition = "VARCHAR(20)")
    private BackupType effectiveType;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "status", columnDefinition = "VARCHAR(20)", nullable = false)
    private ExecutionStatus status;
    
    @Column(name = "started_at", nullable = false)
    private Instant startedAt;
    
    @Column(name = "completed_at")
    private Instant completedAt;
    
    @Column(name = "baseline_at")
    private Instant baselineAt;
    
    @Column(name = "raw_size_bytes", nullable = false)
    private long rawSizeBytes;
    
    @Column(name = "stored_size_bytes", nullable = false)
    private long storedSizeBytes;
    
    @Column(name = "record_count", nullable = false)
    private long recordCount;
    
    @Column(name = "tables_json", columnDefinition = "JSON")
    private String tablesJson;
    
    @Column(name = "latest_change_at")
    private Instant latestChangeAt;
    
    @Column(name = "storage_key", length = 512)
    private String storageKey;
    
    @Column(length = 64)
    private String checksum;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "verification", columnDefinition = "VARCHAR(20)", nullable = false)
    private VerificationState verification;
    
    @Column(name = "recovery_tested", nullable = false)
    private boolean recoveryTested;
    
    @Column(name = "error_detail", columnDefinition = "TEXT")
    private String errorDetail;
    
    @Version
    @Column(nullable = false)
    private Long version;
}
