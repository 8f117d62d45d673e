package com.platform.drengine.health;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only store of health snapshots.
 */
public interface HealthSnapshotRepository {
    
    HealthSnapshot save(HealthSnapshot snapshot);
    
    Optional<HealthSnapshot> findLatest(String primaryRegion);
    
    /**
     * Snapshots of the region captured in {@code [from, to)}, oldest first.
     */
    List<HealthSnapshot> findBetween(String primaryRegion, Instant from, Instant to);
    
    /**
     * @return number of snapshots removed
     */
    int deleteCapturedBefore(Instant cutoff);
}
