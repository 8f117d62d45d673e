package com.platform.drengine.replication;

public enum ReplicationMode {
    /**
     * Writes are acknowledged once a replica confirms receipt. Requires bounded lag.
     */
    SYNC,
    
    /**
     * Writes are acknowledged by the primary alone. Lag is unbounded but monitored.
     */
    ASYNC
}
