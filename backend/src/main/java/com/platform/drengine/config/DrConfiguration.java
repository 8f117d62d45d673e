package com.platform.drengine.config;

import com.platform.drengine.replication.ReplicationMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * DR targets for a scope: the whole system or a single tenant.
 * Cannot be edited while an in-flight operation references it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DrConfiguration {
    
    public static final String SYSTEM_SCOPE = "system";
    
    private String scopeKey;
    
    private int rtoMinutes;
    
    private int rpoMinutes;
    
    /**
     * Default backup cadence as a cron expression.
     */
    private String backupSchedule;
    
    private int retentionDays;
    
    private ReplicationMode replicationMode;
    
    private boolean crossRegion;
    
    private boolean autoFailover;
    
    private boolean approvalRequired;
    
    private Instant updatedAt;
    
    private Long version;
    
    public Duration rtoTarget() {
        return Duration.ofMinutes(rtoMinutes);
    }
    
    public Duration rpoTarget() {
        return Duration.ofMinutes(rpoMinutes);
    }
    
    public static String tenantScope(String tenantId) {
        return "tenant:" + tenantId;
    }
    
    /**
     * RTO 4h, RPO 15min, daily backup at 02:00, 30 days retention, async replication.
     */
    public static DrConfiguration defaults(String scopeKey) {
        return DrConfiguration.builder()
            .scopeKey(scopeKey)
            .rtoMinutes(240)
            .rpoMinutes(15)
            .backupSchedule("0 0 2 * * *")
            .retentionDays(30)
            .replicationMode(ReplicationMode.ASYNC)
            .crossRegion(true)
            .autoFailover(false)
            .approvalRequired(true)
            .build();
    }
}
