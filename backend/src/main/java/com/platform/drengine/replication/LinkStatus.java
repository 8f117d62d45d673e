package com.platform.drengine.replication;

public enum LinkStatus {
    ACTIVE,
    DEGRADED,
    DROPPED;
    
    public boolean isActive() {
        return this != DROPPED;
    }
}
