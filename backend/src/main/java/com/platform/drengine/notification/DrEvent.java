package com.platform.drengine.notification;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Operator-facing event published by the DR engine.
 */
public record DrEvent(
    String eventId,
    EventType eventType,
    NotificationSeverity severity,
    Instant timestamp,
    String message,
    Map<String, String> context
) {
    public enum EventType {
        // Backups
        BACKUP_FAILURE_STREAK,
        BACKUP_VERIFICATION_FAILED,
        
        // Replication
        REPLICATION_LAG_HIGH,
        REPLICATION_LINK_DEGRADED,
        
        // Failover
        FAILOVER_APPROVAL_REQUIRED,
        FAILOVER_TRIGGER_FAILED,
        FAILOVER_STARTED,
        FAILOVER_COMPLETED,
        FAILOVER_ABORTED,
        FAILOVER_ROLLED_BACK,
        ROLLBACK_FAILED,
        
        // Recovery tests
        RECOVERY_TEST_FAILED,
        REMEDIATION_REMINDER,
        
        // Lifecycle
        STARTUP_RECONCILIATION
    }
    
    public static DrEvent create(EventType type, NotificationSeverity severity, String message,
                                 Map<String, String> context, Instant timestamp) {
        return new DrEvent(
            UUID.randomUUID().toString(),
            type,
            severity,
            timestamp,
            message,
            context == null ? Map.of() : Map.copyOf(context)
        );
    }
    
    public boolean requiresIntervention() {
        return severity == NotificationSeverity.CRITICAL;
    }
}
