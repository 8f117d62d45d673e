package com.platform.drengine.backup;

public enum BackupType {
    /**
     * Copies all targeted data.
     */
    FULL("full"),
    
    /**
     * Copies rows changed since the last successful full or incremental backup.
     */
    INCREMENTAL("incremental"),
    
    /**
     * Copies the durable change log since the last archived position.
     */
    LOG_ARCHIVE("log-archive");
    
    private final String fileTag;
    
    BackupType(String fileTag) {
        this.fileTag = fileTag;
    }
    
    public String getFileTag() {
        return fileTag;
    }
}
