package com.platform.drengine.health;

/**
 * Published after a snapshot is persisted.
 */
public record HealthSnapshotRecordedEvent(HealthSnapshot snapshot) {
}
