package com.platform.drengine.core;

import java.time.Duration;

/**
 * Blocking pause used by bounded waits and retry backoff.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
