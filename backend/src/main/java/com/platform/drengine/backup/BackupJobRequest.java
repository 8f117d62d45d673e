package com.platform.drengine.backup;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Definition of a new backup job. Optional fields fall back to the scope's DR configuration
 * and engine defaults.
 */
public record BackupJobRequest(
    @NotBlank String name,
    @NotNull BackupType type,
    String schedule,
    @NotBlank String sourceRegion,
    BackupScope scope,
    String storagePrefix,
    @PositiveOrZero Integer retentionDays,
    boolean allowParallel,
    BackupPriority priority,
    CompressionLevel compression,
    Boolean verifyAfterWrite,
    String configurationScope
) {
}
