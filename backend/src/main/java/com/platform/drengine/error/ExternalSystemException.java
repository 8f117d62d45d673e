package com.platform.drengine.error;

/**
 * Failure reported by an external collaborator (router, metrics source, region, notification channel).
 */
public class ExternalSystemException extends DrEngineException {
    
    private final String system;
    
    public ExternalSystemException(ErrorCode errorCode, String system, String message) {
        super(errorCode, message);
        this.system = system;
    }
    
    public ExternalSystemException(ErrorCode errorCode, String system, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.system = system;
    }
    
    public String getSystem() {
        return system;
    }
}
