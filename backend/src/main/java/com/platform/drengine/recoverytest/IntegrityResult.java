package com.platform.drengine.recoverytest;

import java.util.List;

/**
 * Checks made on a restore: artifact checksums and record counts against the recorded
 * metadata, and the dataset read back from the environment against the expected one.
 */
public record IntegrityResult(
    boolean checksumsMatch,
    boolean recordCountsMatch,
    boolean dataComplete,
    String expectedDigest,
    String actualDigest,
    long restoredRecords,
    List<String> issues
) {
    public IntegrityResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
    
    public boolean isVerified() {
        return checksumsMatch && recordCountsMatch && dataComplete
            && expectedDigest != null && expectedDigest.equals(actualDigest);
    }
}
