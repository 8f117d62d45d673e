package com.platform.drengine.persistence.entity;

import com.platform.drengine.replication.ReplicationMode;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for DR configurations, one row per scope.
 */
@Entity
@Table(name = "dr_configurations")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DrConfigurationEntity {
    
    @Id
    @Column(name = "scope_key", length = 100)
    private String scopeKey;
    
    @Column(name = "rto_minutes", nullable = false)
    private int rtoMinutes;
    
    @Column(name = "rpo_minutes", nullable = false)
    private int rpoMinutes;
    
    @Column(name = "backup_schedule", length = 100)
    private String backupSchedule;
    
    @Column(name = "retention_days", nullable = false)
    private int retentionDays;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "replication_mode", columnDefinition = "VARCHAR(20)", nullable = false)
    private ReplicationMode replicationMode;
    
    @Column(name = "cross_region", nullable = false)
    private boolean crossRegion;
    
    @Column(name = "auto_failover", nullable = false)
    private boolean autoFailover;
    
    @Column(name = "approval_required", nullable = false)
    private boolean approvalRequired;
    
    @Column(name = "updated_at")
    private Instant updatedAt;
    
    @Version
    @Column(nullable = false)
    private Long version;
}
