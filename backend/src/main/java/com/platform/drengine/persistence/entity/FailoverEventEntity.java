package com.platform.drengine.persistence.entity;

import com.platform.drengine.failover.FailoverOutcome;
import com.platform.drengine.failover.FailoverState;
import com.platform.drengine.failover.TriggerType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for failover events. The transition history is stored as a JSON array.
 */
@Entity
@Table(name = "failover_events", indexes = {
    @Index(name = "idx_failover_region_started", columnList = "primary_region, started_at"),
    @Index(name = "idx_failover_state", columnList = "state")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailoverEventEntity {
    
    @Id
    @Column(length = 36)
    private String id;
    
    @Column(name = "primary_region", length = 100, nullable = false)
    private String primaryRegion;
    
    @Column(name = "target_region", length = 100, nullable = false)
    private String targetRegion;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", columnDefinition = "VARCHAR(20)", nullable = false)
    private TriggerType triggerType;
    
    @Column(name = "requested_by")
    private String requestedBy;
    
    @Column(columnDefinition = "TEXT")
    private String reason;
    
    @Column(name = "override_safety_checks", nullable = false)
    private boolean overrideSafetyChecks;
    
    @Column(name = "configuration_scope", length = 100)
    private String configurationScope;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "state", columnDefinition = "VARCHAR(20)", nullable = false)
    private FailoverState state;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", columnDefinition = "VARCHAR(20)")
    private FailoverOutcome outcome;
    
    private Boolean completed;
    
    @Column(name = "rollback_successful")
    private Boolean rollbackSuccessful;
    
    @Column(name = "started_at", nullable = false)
    private Instant startedAt;
    
    @Column(name = "ended_at")
    private Instant endedAt;
    
    @Column(name = "replica_lag_at_promotion_nanos")
    private Long replicaLagAtPromotionNanos;
    
    @Column(name = "terminated_transactions", nullable = false)
    private int terminatedTransactions;
    
    @Column(name = "failure_detail", columnDefinition = "TEXT")
    private String failureDetail;
    
    @Column(name = "cancelled_by")
    private String cancelledBy;
    
    @Column(name = "transitions_json", columnDefinition = "JSON", nullable = false)
    private String transitionsJson;
    
    /**
     * Optimistic locking version for concurrent update safety.
     */
    @Version
    @Column(nullable = false)
    private Long version;
}
