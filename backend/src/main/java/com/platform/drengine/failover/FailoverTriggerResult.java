package com.platform.drengine.failover;

import com.platform.drengine.error.ErrorCode;

import java.util.UUID;

/**
 * Answer to a failover trigger. Only ACCEPTED starts a run.
 */
public record FailoverTriggerResult(
    Status status,
    UUID eventId,
    String errorCode,
    String message
) {
    public enum Status {
        ACCEPTED,
        
        /**
         * Another failover of the same primary is active; {@code eventId} names it.
         */
        REJECTED_IN_PROGRESS,
        
        /**
         * Automatic trigger while the configuration requires operator approval.
         */
        APPROVAL_REQUIRED,
        
        AUTO_FAILOVER_DISABLED
    }
    
    public static FailoverTriggerResult accepted(UUID eventId) {
        return new FailoverTriggerResult(Status.ACCEPTED, eventId, null, "Failover started");
    }
    
    public static FailoverTriggerResult inProgress(UUID activeEventId, String message) {
        return new FailoverTriggerResult(Status.REJECTED_IN_PROGRESS, activeEventId,
            ErrorCode.FAILOVER_IN_PROGRESS.getCode(), message);
    }
    
    public static FailoverTriggerResult approvalRequired(String message) {
        return new FailoverTriggerResult(Status.APPROVAL_REQUIRED, null, null, message);
    }
    
    public static FailoverTriggerResult autoFailoverDisabled(String message) {
        return new FailoverTriggerResult(Status.AUTO_FAILOVER_DISABLED, null, null, message);
    }
    
    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }
}
