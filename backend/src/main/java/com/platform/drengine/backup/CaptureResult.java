package com.platform.drengine.backup;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Records captured by a backup source, with the tables they came from.
 */
public record CaptureResult(List<String> tables, List<BackupRecord> records) {
    
    public Instant latestChangeAt() {
        return records.stream()
            .map(BackupRecord::changedAt)
            .filter(Objects::nonNull)
            .max(Comparator.naturalOrder())
            .orElse(null);
    }
}
