package com.platform.drengine.backup;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * First line of every backup artifact.
 */
public record ArtifactHeader(
    int formatVersion,
    UUID executionId,
    UUID jobId,
    BackupType type,
    Instant createdAt,
    Instant baselineAt,
    Instant capturedUntil,
    BackupScope scope,
    List<String> tables,
    long recordCount,
    Instant latestChangeAt
) {
    public static final int CURRENT_FORMAT = 1;
}
