package com.platform.drengine.health;

/**
 * External source of connection and resource numbers for a region.
 */
public interface MetricsSource {
    
    MetricsSample sample(String region);
}
