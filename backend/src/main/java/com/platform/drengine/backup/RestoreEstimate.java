package com.platform.drengine.backup;

import java.time.Duration;

/**
 * Expected restore time of a job's current restore chain.
 * {@code estimatedDuration} is null when no prior execution gives a throughput figure.
 */
public record RestoreEstimate(
    int artifacts,
    long totalBytes,
    double bytesPerSecond,
    Duration estimatedDuration
) {
    public boolean isKnown() {
        return estimatedDuration != null;
    }
}
