package com.platform.drengine.error;

/**
 * Base exception for all DR engine exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class DrEngineException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected DrEngineException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    protected DrEngineException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected DrEngineException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
