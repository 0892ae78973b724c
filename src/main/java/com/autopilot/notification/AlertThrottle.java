package com.autopilot.notification;

import com.autopilot.config.NotificationSettings;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Per-alert-key cooldown: an alert is sent only if the same key was not sent within the cooldown
 * window.
 */
@Component
public class AlertThrottle {

    private final Duration cooldown;
    private final Map<String, Instant> lastSent = new ConcurrentHashMap<>();

    public AlertThrottle(NotificationSettings notificationSettings) {
        this.cooldown = notificationSettings.getCooldown();
    }

    /** Returns true and records {@code now} if the key is outside its cooldown window. */
    public boolean tryAcquire(String key, Instant now) {
        boolean[] acquired = {false};
        lastSent.compute(key, (k, previous) -> {
            if (previous == null || !now.isBefore(previous.plus(cooldown))) {
                acquired[0] = true;
                return now;
            }
            return previous;
        });
        return acquired[0];
    }

    /** Drops keys whose window has elapsed. */
    public void evictExpired(Instant now) {
        lastSent.entrySet().removeIf(e -> !now.isBefore(e.getValue().plus(cooldown)));
    }
}
