package com.platform.drengine.failover;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One failover attempt. Only the orchestrator run that owns the event mutates it,
 * and only through {@link FailoverStateMachine}; once terminal it never changes again.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FailoverEvent {
    
    private UUID id;
    
    private String primaryRegion;
    
    private String targetRegion;
    
    private TriggerType triggerType;
    
    private String requestedBy;
    
    private String reason;
    
    private boolean overrideSafetyChecks;
    
    private String configurationScope;
    
    private FailoverState state;
    
    private FailoverOutcome outcome;
    
    /**
     * True once COMPLETED; false for every other terminal state.
     */
    private Boolean completed;
    
    /**
     * Set only when a rollback was attempted.
     */
    private Boolean rollbackSuccessful;
    
    private Instant startedAt;
    
    private Instant endedAt;
    
    private Duration replicaLagAtPromotion;
    
    private int terminatedTransactions;
    
    private String failureDetail;
    
    private String cancelledBy;
    
    @Builder.Default
    private List<StateTransition> transitions = new ArrayList<>();
    
    private Long version;
    
    public boolean isTerminal() {
        return state != null && state.isTerminal();
    }
    
    public Duration duration() {
        return startedAt == null || endedAt == null ? null : Duration.between(startedAt, endedAt);
    }
}
