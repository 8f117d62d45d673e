package com.platform.drengine.failover;

public enum TriggerType {
    /**
     * Raised from a health snapshot recommending failover.
     */
    AUTOMATIC,
    
    /**
     * Operator break-glass call.
     */
    MANUAL,
    
    /**
     * Scheduled switchover, including recovery-test drills.
     */
    PLANNED
}
