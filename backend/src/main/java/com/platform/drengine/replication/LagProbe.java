package com.platform.drengine.replication;

import java.time.Duration;

/**
 * Measures how far a replica trails its primary.
 */
public interface LagProbe {

    /**
     * Delta between the latest change committed on the primary and the latest change applied on the replica.
     * Never negative.
     */
    Duration measureLag(String primaryRegion, String replicaRegion);
}
