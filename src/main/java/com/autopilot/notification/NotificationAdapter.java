package com.autopilot.notification;

import com.autopilot.domain.enums.AlertSeverity;

/**
 * Outgoing operator channel. Best effort: callers go through {@link NotificationService}, which
 * applies the cooldown and never calls this from the order-submission path.
 */
public interface NotificationAdapter {

    void notify(AlertSeverity severity, String message);
}
