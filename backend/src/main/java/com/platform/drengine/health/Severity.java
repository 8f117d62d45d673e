package com.platform.drengine.health;

/**
 * Health severity, ordered from best to worst.
 */
public enum Severity {
    HEALTHY(0),
    WARNING(1),
    CRITICAL(2);
    
    private final int level;
    
    Severity(int level) {
        this.level = level;
    }
    
    public int getLevel() {
        return level;
    }
    
    public boolean isRaised() {
        return this != HEALTHY;
    }
    
    public Severity max(Severity other) {
        return other != null && other.level > level ? other : this;
    }
}
