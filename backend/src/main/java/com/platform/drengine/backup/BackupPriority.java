package com.platform.drengine.backup;

public enum BackupPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
