package com.platform.drengine.backup;

import java.time.Instant;

/**
 * Reads the data a backup copies from the source region.
 */
public interface BackupSource {

    /**
     * @param since exclusive lower bound of the change window; ignored for full backups
     * @param until inclusive upper bound of the change window
     */
    CaptureResult capture(String sourceRegion, BackupScope scope, BackupType type, Instant since, Instant until);
}
