package com.platform.drengine.replication;

/**
 * Control operations against the database of a region, used by failover and link management.
 */
public interface RegionController {

    /**
     * Stops accepting new writes on the region.
     */
    void stopWrites(String region);

    void resumeWrites(String region);

    /**
     * Number of write transactions still open on the region.
     */
    int inFlightWrites(String region);

    /**
     * Forcibly ends the remaining write transactions.
     *
     * @return number of terminated transactions
     */
    int terminateInFlightWrites(String region);

    /**
     * Converts the region's replica into a writable primary.
     */
    void promote(String region);

    /**
     * Synthetic write and read against the region.
     */
    boolean healthCheck(String region);

    void applyReplicationMode(String primaryRegion, String replicaRegion, ReplicationMode mode);
}
