package com.platform.drengine.recoverytest;

public enum TestStatus {
    SCHEDULED,
    RUNNING,
    PASSED,
    FAILED;
    
    public boolean isFinal() {
        return this == PASSED || this == FAILED;
    }
}
