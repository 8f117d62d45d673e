package com.platform.drengine.recoverytest;

/**
 * Kind of environment a recovery test runs against. Tests never run against PRODUCTION.
 */
public enum EnvironmentType {
    STAGING,
    DEVELOPMENT,
    DISASTER_RECOVERY,
    PRODUCTION;
    
    public boolean isProduction() {
        return this == PRODUCTION;
    }
}
