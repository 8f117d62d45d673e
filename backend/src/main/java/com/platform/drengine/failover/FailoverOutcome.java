package com.platform.drengine.failover;

public enum FailoverOutcome {
    SUCCEEDED,
    ABORTED,
    ROLLED_BACK,
    
    /**
     * Rollback itself failed. Needs manual intervention; never retried automatically.
     */
    ROLLBACK_FAILED
}
