package com.platform.drengine.health;

/**
 * Independent failover signals evaluated per snapshot.
 */
public enum IndicatorType {
    LAG,
    SATURATION,
    BACKUP
}
