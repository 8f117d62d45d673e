package com.platform.drengine.error;

/**
 * Configuration and request validation errors.
 * Always raised before any side effect has happened.
 */
public class ValidationException extends DrEngineException {
    
    private final String field;
    private final Object rejectedValue;
    
    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
        this.field = null;
        this.rejectedValue = null;
    }
    
    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
        this.field = null;
        this.rejectedValue = null;
    }
    
    public ValidationException(String field, String message) {
        super(ErrorCode.INVALID_FIELD_VALUE, 
            String.format("Invalid value for field '%s': %s", field, message));
        this.field = field;
        this.rejectedValue = null;
    }
    
    public ValidationException(String field, Object rejectedValue, String message) {
        super(ErrorCode.INVALID_FIELD_VALUE, 
            String.format("Invalid value '%s' for field '%s': %s", rejectedValue, field, message));
        this.field = field;
        this.rejectedValue = rejectedValue;
    }
    
    public String getField() {
        return field;
    }
    
    public Object getRejectedValue() {
        return rejectedValue;
    }
}
