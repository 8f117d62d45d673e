package com.platform.drengine.backup;

import java.time.Instant;
import java.util.Map;

/**
 * One captured row change. {@code key} holds the primary key columns; {@code row} is empty for deletes.
 */
public record BackupRecord(
    String table,
    Operation operation,
    Map<String, Object> key,
    Map<String, Object> row,
    Instant changedAt
) {
    public enum Operation {
        UPSERT,
        DELETE
    }
    
    public static BackupRecord upsert(String table, Map<String, Object> key, Map<String, Object> row, Instant changedAt) {
        return new BackupRecord(table, Operation.UPSERT, key, row, changedAt);
    }
    
    public static BackupRecord delete(String table, Map<String, Object> key, Instant changedAt) {
        return new BackupRecord(table, Operation.DELETE, key, Map.of(), changedAt);
    }
}
