package com.platform.drengine.error;

import java.util.UUID;

/**
 * Raised when a trigger names a primary region that already has a non-terminal failover.
 */
public class FailoverInProgressException extends DrEngineException {
    
    private final String primaryRegion;
    private final UUID activeEventId;
    
    public FailoverInProgressException(String primaryRegion, UUID activeEventId) {
        super(ErrorCode.FAILOVER_IN_PROGRESS,
            String.format("Failover %s is already in progress for primary region %s", activeEventId, primaryRegion));
        this.primaryRegion = primaryRegion;
        this.activeEventId = activeEventId;
    }
    
    public String getPrimaryRegion() {
        return primaryRegion;
    }
    
    public UUID getActiveEventId() {
        return activeEventId;
    }
}
