package com.platform.drengine.replication;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Directed replication feed from a primary region to a replica region.
 * At most one link exists per (primary, replica) pair.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReplicationLink {
    
    private UUID id;
    
    private String primaryRegion;
    
    private String replicaRegion;
    
    private String slotId;
    
    private ReplicationMode mode;
    
    private boolean crossRegion;
    
    private LinkStatus status;
    
    /**
     * Last measured lag, null until the first successful probe.
     */
    private Duration lastLag;
    
    private Instant lastMeasuredAt;
    
    private int consecutiveProbeErrors;
    
    private Instant createdAt;
    
    private Long version;
    
    public boolean isActive() {
        return status != null && status.isActive();
    }
    
    /**
     * Healthy when active, not degraded and its last measured lag is within the bound.
     */
    public boolean isHealthy(Duration maxLag) {
        return status == LinkStatus.ACTIVE
            && lastLag != null
            && lastLag.compareTo(maxLag) <= 0;
    }
    
    public static String slotIdFor(String primaryRegion, String replicaRegion) {
        return ("dr_" + primaryRegion + "_to_" + replicaRegion).toLowerCase().replaceAll("[^a-z0-9_]", "_");
    }
}
