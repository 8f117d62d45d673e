package com.platform.drengine.error;

/**
 * Raised when a DR configuration is edited while an in-flight operation references it.
 */
public class ConfigurationLockedException extends DrEngineException {
    
    private final String scopeKey;
    private final int inFlightReferences;
    
    public ConfigurationLockedException(String scopeKey, int inFlightReferences) {
        super(ErrorCode.CONFIGURATION_LOCKED,
            String.format("DR configuration %s is referenced by %d in-flight operation(s)", scopeKey, inFlightReferences));
        this.scopeKey = scopeKey;
        this.inFlightReferences = inFlightReferences;
    }
    
    public String getScopeKey() {
        return scopeKey;
    }
    
    public int getInFlightReferences() {
        return inFlightReferences;
    }
}
