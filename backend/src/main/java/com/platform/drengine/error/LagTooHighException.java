package com.platform.drengine.error;

import java.time.Duration;
import java.util.UUID;

/**
 * Raised when a link cannot switch to synchronous mode because its lag is above the threshold.
 */
public class LagTooHighException extends DrEngineException {
    
    private final UUID linkId;
    private final Duration currentLag;
    private final Duration threshold;
    
    public LagTooHighException(UUID linkId, Duration currentLag, Duration threshold) {
        super(ErrorCode.LAG_TOO_HIGH,
            String.format("Link %s lag %s is not below %s", linkId, currentLag, threshold));
        this.linkId = linkId;
        this.currentLag = currentLag;
        this.threshold = threshold;
    }
    
    public UUID getLinkId() {
        return linkId;
    }
    
    public Duration getCurrentLag() {
        return currentLag;
    }
    
    public Duration getThreshold() {
        return threshold;
    }
}
