package com.platform.drengine.replication;

import java.time.Duration;
import java.util.UUID;

/**
 * Outcome of a replication mode change. A lag rejection is an expected result, not an error.
 */
public record ReconfigureResult(
    UUID linkId,
    Status status,
    ReplicationMode mode,
    Duration currentLag,
    Duration threshold,
    String message
) {
    public enum Status {
        APPLIED,
        UNCHANGED,
        REJECTED_LAG_TOO_HIGH
    }
    
    public static ReconfigureResult applied(UUID linkId, ReplicationMode mode, Duration currentLag) {
        return new ReconfigureResult(linkId, Status.APPLIED, mode, currentLag, null,
            "Link switched to " + mode);
    }
    
    public static ReconfigureResult unchanged(UUID linkId, ReplicationMode mode) {
        return new ReconfigureResult(linkId, Status.UNCHANGED, mode, null, null,
            "Link already in " + mode + " mode");
    }
    
    public static ReconfigureResult lagTooHigh(UUID linkId, ReplicationMode currentMode, Duration currentLag, Duration threshold) {
        return new ReconfigureResult(linkId, Status.REJECTED_LAG_TOO_HIGH, currentMode, currentLag, threshold,
            "Replication lag " + currentLag + " is not below " + threshold + "; retry later");
    }
    
    public boolean isApplied() {
        return status != Status.REJECTED_LAG_TOO_HIGH;
    }
}
