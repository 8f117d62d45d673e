package com.platform.drengine.routing;

import java.util.Optional;

/**
 * Directs client traffic for a database cluster to a region.
 * The route key names the cluster by its original primary region.
 */
public interface ConnectionRouter {

    void updateTarget(String routeKey, String region);

    Optional<String> currentTarget(String routeKey);
}
