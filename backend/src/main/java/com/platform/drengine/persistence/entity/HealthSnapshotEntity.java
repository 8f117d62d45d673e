package com.platform.drengine.persistence.entity;

import com.platform.drengine.health.Severity;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for health snapshots. Rows are inserted once and never updated.
 */
@Entity
@Table(name = "health_snapshots", indexes = {
    @Index(name = "idx_health_region_captured", columnList = "primary_region, captured_at"),
    @Index(name = "idx_health_captured", columnList = "captured_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthSnapshotEntity {
    
    @Id
    @Column(length = 36)
    private String id;
    
    @Column(name = "primary_region", length = 100, nullable = false, updatable = false)
    private String primaryRegion;
    
    @Column(name = "captured_at", nullable = false, updatable = false)
    private Instant capturedAt;
    
    @Column(name = "active_connections")
    private Long activeConnections;
    
    @Column(name = "max_replication_lag_nanos")
    private Long maxReplicationLagNanos;
    
    @Column(name = "saturation_percent")
    private Double saturationPercent;
    
    @Column(name = "failed_backups_last_24h", nullable = false)
    private int failedBackupsLast24h;
    
    @Column(name = "consecutive_backup_failures", nullable = false)
    private int consecutiveBackupFailures;
    
    @Column(name = "indicators_json", columnDefinition = "JSON", nullable = false)
    private String indicatorsJson;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "severity", columnDefinition = "VARCHAR(20)", nullable = false)
    private Severity severity;
    
    @Column(name = "failover_recommended", nullable = false)
    private boolean failoverRecommended;
    
    @Column(name = "notes_json", columnDefinition = "JSON")
    private String notesJson;
}
