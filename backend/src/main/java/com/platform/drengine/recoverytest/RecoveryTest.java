package com.platform.drengine.recoverytest;

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
 * A scheduled or ad-hoc DR exercise. Created SCHEDULED, finalized once as PASSED or FAILED.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryTest {
    
    private UUID id;
    
    private ScenarioType scenario;
    
    private String environment;
    
    private EnvironmentType environmentType;
    
    /**
     * Backup job whose lineage is restored. Null for pure failover drills.
     */
    private UUID backupJobId;
    
    private String configurationScope;
    
    /**
     * Cron expression for recurring tests, null for one-off runs.
     */
    private String cadence;
    
    private Instant scheduledFor;
    
    /**
     * Restore target instant for point-in-time tests. Null means "offset before the run starts".
     */
    private Instant pointInTime;
    
    private String requestedBy;
    
    private TestStatus status;
    
    private Duration targetRto;
    
    private Duration targetRpo;
    
    private Duration estimatedRestore;
    
    private Instant startedAt;
    
    private Instant completedAt;
    
    private Duration actualRto;
    
    private Duration actualRpo;
    
    private Boolean dataIntegrityVerified;
    
    private Boolean passed;
    
    private boolean remediationRequired;
    
    @Builder.Default
    private List<String> issuesFound = new ArrayList<>();
    
    @Builder.Default
    private List<UUID> restoredExecutions = new ArrayList<>();
    
    private UUID failoverEventId;
    
    private Long version;
    
    public boolean isRecurring() {
        return cadence != null && !cadence.isBlank();
    }
}
