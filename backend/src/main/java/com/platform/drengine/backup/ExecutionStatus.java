package com.platform.drengine.backup;

public enum ExecutionStatus {
    RUNNING,
    COMPLETED,
    FAILED;
    
    public boolean isTerminal() {
        return this != RUNNING;
    }
}
