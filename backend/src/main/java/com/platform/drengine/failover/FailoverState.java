package com.platform.drengine.failover;

/**
 * States of a failover event.
 * 
 * Success path: IDLE, SAFETY_CHECK, DRAINING, PROMOTING, REROUTING, VERIFYING, COMPLETED.
 * PROMOTING is the point of no return: from there the event ends COMPLETED or goes through
 * ROLLING_BACK to ROLLED_BACK. Before it, the event can only end ABORTED.
 */
public enum FailoverState {
    IDLE,
    
    /**
     * Target replica lag and fallback links are checked. No side effects.
     */
    SAFETY_CHECK,
    
    /**
     * Writes stopped on the current primary, in-flight transactions finishing.
     */
    DRAINING,
    
    PROMOTING,
    
    REROUTING,
    
    /**
     * Synthetic health check against the new primary.
     */
    VERIFYING,
    
    COMPLETED,
    
    ROLLING_BACK,
    
    ROLLED_BACK,
    
    /**
     * Ended before promotion; production state untouched or restored.
     */
    ABORTED;
    
    public boolean isTerminal() {
        return this == COMPLETED || this == ROLLED_BACK || this == ABORTED;
    }
    
    /**
     * True while the event may still be cancelled.
     */
    public boolean isBeforePointOfNoReturn() {
        return this == IDLE || this == SAFETY_CHECK || this == DRAINING;
    }
}
