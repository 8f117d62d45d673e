package com.platform.drengine.persistence.entity;

import com.platform.drengine.replication.LinkStatus;
import com.platform.drengine.replication.ReplicationMode;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for replication links. Lag is kept in nanoseconds.
 */
@Entity
@Table(name = "replication_links",
    uniqueConstraints = @UniqueConstraint(name = "uk_replication_pair", columnNames = {"primary_region", "replica_region"}),
    indexes = @Index(name = "idx_replication_primary", columnList = "primary_region"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReplicationLinkEntity {
    
    @Id
    @Column(length = 36)
    private String id;
    
    @Column(name = "primary_region", length = 100, nullable = false)
    private String primaryRegion;
    
    @Column(name = "replica_region", length = 100, nullable = false)
    private String replicaRegion;
    
    @Column(name = "slot_id", nullable = false)
    private String slotId;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "mode", columnDefinition = "VARCHAR(20)", nullable = false)
    private ReplicationMode mode;
    
    @Column(name = "cross_region", nullable = false)
    private boolean crossRegion;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "status", columnDefinition = "VARCHAR(20)", nullable = false)
    private LinkStatus status;
    
    @Column(name = "last_lag_nanos")
    private Long lastLagNanos;
    
    @Column(name = "last_measured_at")
    private Instant lastMeasuredAt;
    
    @Column(name = "consecutive_probe_errors", nullable = false)
    private int consecutiveProbeErrors;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Version
    @Column(nullable = false)
    private Long version;
}
