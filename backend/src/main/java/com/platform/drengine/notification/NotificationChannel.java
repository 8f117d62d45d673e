package com.platform.drengine.notification;

/**
 * Outbound channel for operator alerts: failed rollbacks, test failures,
 * backup failure streaks and approval requests.
 */
public interface NotificationChannel {

    void notify(DrEvent event);
}
