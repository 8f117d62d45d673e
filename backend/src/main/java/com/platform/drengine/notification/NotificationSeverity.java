package com.platform.drengine.notification;

public enum NotificationSeverity {
    INFO,
    WARNING,
    CRITICAL
}
