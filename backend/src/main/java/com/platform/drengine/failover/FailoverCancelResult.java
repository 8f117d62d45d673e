package com.platform.drengine.failover;

import com.platform.drengine.error.ErrorCode;

import java.util.UUID;

/**
 * Answer to a cancellation request. An accepted cancellation takes effect at the run's next
 * check, which ends the event ABORTED.
 */
public record FailoverCancelResult(
    Status status,
    UUID eventId,
    FailoverState state,
    String errorCode,
    String message
) {
    public enum Status {
        CANCELLATION_REQUESTED,
        PAST_POINT_OF_NO_RETURN,
        ALREADY_TERMINAL
    }
    
    public static FailoverCancelResult requested(UUID eventId, FailoverState state) {
        return new FailoverCancelResult(Status.CANCELLATION_REQUESTED, eventId, state, null,
            "Cancellation requested in " + state);
    }
    
    public static FailoverCancelResult pastPointOfNoReturn(UUID eventId, FailoverState state) {
        return new FailoverCancelResult(Status.PAST_POINT_OF_NO_RETURN, eventId, state,
            ErrorCode.CANCELLATION_REJECTED.getCode(), "Failover is in " + state + " and can no longer be cancelled");
    }
    
    public static FailoverCancelResult alreadyTerminal(UUID eventId, FailoverState state) {
        return new FailoverCancelResult(Status.ALREADY_TERMINAL, eventId, state, null,
            "Failover already ended in " + state);
    }
    
    public boolean isAccepted() {
        return status == Status.CANCELLATION_REQUESTED;
    }
}
