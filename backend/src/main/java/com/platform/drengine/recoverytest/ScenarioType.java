package com.platform.drengine.recoverytest;

public enum ScenarioType {
    /**
     * Restore the latest restore chain into the environment and validate it.
     */
    BACKUP_RESTORE,
    
    /**
     * Planned failover across the environment's own regions.
     */
    FAILOVER,
    
    /**
     * Restore to an earlier instant by replaying log archives over the restore chain.
     */
    POINT_IN_TIME,
    
    /**
     * Backup restore followed by a failover.
     */
    FULL_DISASTER;
    
    public boolean needsBackupJob() {
        return this != FAILOVER;
    }
    
    public boolean needsFailoverTopology() {
        return this == FAILOVER || this == FULL_DISASTER;
    }
}
