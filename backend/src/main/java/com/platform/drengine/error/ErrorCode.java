package com.platform.drengine.error;

/**
 * Standardized error codes for the DR engine.
 * Each error has a unique code that clients can use to take specific actions.
 * 
 * Format: DR-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Configuration / validation errors
 * - 3xx: Resource and contention errors (not found, in progress, locked)
 * - 4xx: External collaborator errors (storage, router, metrics, regions)
 * - 5xx: DR domain errors (backup, replication, failover, recovery tests)
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {
    
    // ==================== Configuration Errors (1xx) ====================
    
    VALIDATION_ERROR("DR-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("DR-101", "Invalid request format", ErrorCategory.RECOVERABLE),
    MISSING_REQUIRED_FIELD("DR-102", "Missing required field", ErrorCategory.RECOVERABLE),
    INVALID_FIELD_VALUE("DR-103", "Invalid field value", ErrorCategory.RECOVERABLE),
    UNKNOWN_REGION("DR-110", "Region is not configured", ErrorCategory.RECOVERABLE),
    UNKNOWN_ENVIRONMENT("DR-111", "Environment is not configured", ErrorCategory.RECOVERABLE),
    PRODUCTION_ENVIRONMENT_REJECTED("DR-112", "Recovery tests require a non-production environment", ErrorCategory.RECOVERABLE),
    INVALID_SCHEDULE("DR-113", "Invalid schedule expression", ErrorCategory.RECOVERABLE),
    
    // ==================== Resource / Contention Errors (3xx) ====================
    
    RESOURCE_NOT_FOUND("DR-300", "Resource not found", ErrorCategory.RECOVERABLE),
    BACKUP_JOB_NOT_FOUND("DR-301", "Backup job not found", ErrorCategory.RECOVERABLE),
    BACKUP_EXECUTION_NOT_FOUND("DR-302", "Backup execution not found", ErrorCategory.RECOVERABLE),
    REPLICATION_LINK_NOT_FOUND("DR-303", "Replication link not found", ErrorCategory.RECOVERABLE),
    FAILOVER_EVENT_NOT_FOUND("DR-304", "Failover event not found", ErrorCategory.RECOVERABLE),
    RECOVERY_TEST_NOT_FOUND("DR-305", "Recovery test not found", ErrorCategory.RECOVERABLE),
    CONFIGURATION_NOT_FOUND("DR-306", "DR configuration not found", ErrorCategory.RECOVERABLE),
    FAILOVER_IN_PROGRESS("DR-310", "A failover is already in progress for this primary region", ErrorCategory.RECOVERABLE),
    BACKUP_ALREADY_RUNNING("DR-311", "Backup job already has a running execution", ErrorCategory.RECOVERABLE),
    CONFIGURATION_LOCKED("DR-312", "DR configuration is referenced by an in-flight operation", ErrorCategory.RECOVERABLE),
    LAG_TOO_HIGH("DR-313", "Replication lag too high for the requested mode", ErrorCategory.RECOVERABLE),
    CANCELLATION_REJECTED("DR-314", "Failover is past the point of no return", ErrorCategory.RECOVERABLE),
    OPTIMISTIC_LOCK_FAILURE("DR-315", "Concurrent modification", ErrorCategory.RECOVERABLE),
    
    // ==================== External Collaborator Errors (4xx) ====================
    
    DATABASE_ERROR("DR-400", "Database error", ErrorCategory.FATAL),
    STORAGE_UNAVAILABLE("DR-410", "Storage backend unavailable", ErrorCategory.FATAL),
    STORAGE_OBJECT_NOT_FOUND("DR-411", "Storage object not found", ErrorCategory.RECOVERABLE),
    STORAGE_KEY_INVALID("DR-412", "Storage key is invalid", ErrorCategory.RECOVERABLE),
    ROUTER_UNAVAILABLE("DR-420", "Connection router unavailable", ErrorCategory.RECOVERABLE),
    METRICS_UNAVAILABLE("DR-430", "Metrics source unavailable", ErrorCategory.RECOVERABLE),
    REGION_UNREACHABLE("DR-440", "Region unreachable", ErrorCategory.RECOVERABLE),
    NOTIFICATION_FAILED("DR-450", "Notification delivery failed", ErrorCategory.RECOVERABLE),
    
    // ==================== DR Domain Errors (5xx) ====================
    
    BACKUP_FAILED("DR-500", "Backup execution failed", ErrorCategory.RECOVERABLE),
    BACKUP_VERIFICATION_FAILED("DR-501", "Backup artifact verification failed", ErrorCategory.RECOVERABLE),
    ARTIFACT_CORRUPT("DR-502", "Backup artifact is corrupt", ErrorCategory.FATAL),
    LAG_PROBE_FAILED("DR-510", "Replication lag could not be measured", ErrorCategory.RECOVERABLE),
    PROMOTION_FAILED("DR-520", "Replica promotion failed", ErrorCategory.RECOVERABLE),
    REROUTE_FAILED("DR-521", "Traffic rerouting failed", ErrorCategory.RECOVERABLE),
    ROLLBACK_FAILED("DR-522", "Failover rollback failed", ErrorCategory.FATAL),
    STATE_TRANSITION_INVALID("DR-523", "Invalid failover state transition", ErrorCategory.RECOVERABLE),
    RESTORE_FAILED("DR-530", "Restore into test environment failed", ErrorCategory.RECOVERABLE),
    
    // ==================== Internal Errors (9xx) ====================
    
    INTERNAL_ERROR("DR-900", "Internal server error", ErrorCategory.FATAL),
    UNEXPECTED_ERROR("DR-901", "Unexpected error occurred", ErrorCategory.FATAL),
    CONFIGURATION_ERROR("DR-902", "Configuration error", ErrorCategory.FATAL),
    SERIALIZATION_ERROR("DR-903", "Serialization error", ErrorCategory.RECOVERABLE);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    public boolean isRecoverable() {
        return category == ErrorCategory.RECOVERABLE;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - client can retry or fix the request.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - engine or a collaborator is in a bad state, may require intervention.
         */
        FATAL
    }
}
