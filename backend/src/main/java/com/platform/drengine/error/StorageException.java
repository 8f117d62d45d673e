package com.platform.drengine.error;

/**
 * Storage backend failures (unreachable, missing object, invalid key, corrupt artifact).
 */
public class StorageException extends DrEngineException {
    
    private final String key;
    
    public StorageException(ErrorCode errorCode, String key, String message) {
        super(errorCode, message);
        this.key = key;
    }
    
    public StorageException(ErrorCode errorCode, String key, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.key = key;
    }
    
    public String getKey() {
        return key;
    }
}
