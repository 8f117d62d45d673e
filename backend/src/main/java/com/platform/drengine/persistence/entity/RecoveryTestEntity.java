package com.platform.drengine.persistence.entity;

import com.platform.drengine.recoverytest.EnvironmentType;
import com.platform.drengine.recoverytest.ScenarioType;
import com.platform.drengine.recoverytest.TestStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for recovery tests. Durations are kept in nanoseconds.
 */
@Entity
@Table(name = "recovery_tests", indexes = {
    @Index(name = "idx_recovery_status_scheduled", columnList = "status, scheduled_for"),
    @Index(name = "idx_recovery_completed", columnList = "completed_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryTestEntity {
    
    @Id
    @Column(length = 36)
    private String id;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "scenario", columnDefinition = "VARCHAR(30)", nullable = false)
    private ScenarioType scenario;
    
    @Column(length = 100, nullable = false)
    private String environment;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "environment_type", columnDefinition = "VARCHAR(30)", nullable = false)
    private EnvironmentType environmentType;
    
    @Column(name = "backup_job_id", length = 36)
    private String backupJobId;
    
    @Column(name = "configuration_scope", length = 100, nullable = false)
    private String configurationScope;
    
    @Column(length = 100)
    private String cadence;
    
    @Column(name = "scheduled_for")
    private Instant scheduledFor;
    
    @Column(name = "point_in_time")
    private Instant pointInTime;
    
    @Column(name = "requested_by")
    private String requestedBy;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "status", columnDefinition = "VARCHAR(20)", nullable = false)
    private TestStatus status;
    
    @Column(name = "target_rto_nanos")
    private Long targetRtoNanos;
    
    @Column(name = "target_rpo_nanos")
    private Long targetRpoNanos;
    
    @Column(name = "estimated_restore_nanos")
    private Long estimatedRestoreNanos;
    
    @Column(name = "started_at")
    private Instant startedAt;
    
    @Column(name = "completed_at")
    private Instant completedAt;
    
    @Column(name = "actual_rto_nanos")
    private Long actualRtoNanos;
    
    @Column(name = "actual_rpo_nanos")
    private Long actualRpoNanos;
    
    @Column(name = "data_integrity_verified")
    private Boolean dataIntegrityVerified;
    
    private Boolean passed;
    
    @Column(name = "remediation_required", nullable = false)
    private boolean remediationRequired;
    
    @Column(name = "issues_json", columnDefinition = "JSON")
    private String issuesJson;
    
    @Column(name = "restored_executions_json", columnDefinition = "JSON")
    private String restoredExecutionsJson;
    
    @Column(name = "failover_event_id", length = 36)
    private String failoverEventId;
    
    @Version
    @Column(nullable = false)
    private Long version;
}
