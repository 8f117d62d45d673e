package com.platform.drengine.error;

import java.util.UUID;

/**
 * Raised when a failover event is asked to move along an edge the state machine does not allow.
 */
public class InvalidStateTransitionException extends DrEngineException {
    
    private final UUID eventId;
    private final String from;
    private final String to;
    
    public InvalidStateTransitionException(UUID eventId, Object from, Object to) {
        super(ErrorCode.STATE_TRANSITION_INVALID,
            String.format("Failover %s cannot move from %s to %s", eventId, from, to));
        this.eventId = eventId;
        this.from = String.valueOf(from);
        this.to = String.valueOf(to);
    }
    
    public UUID getEventId() {
        return eventId;
    }
    
    public String getFrom() {
        return from;
    }
    
    public String getTo() {
        return to;
    }
}
