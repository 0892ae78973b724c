package com.autopilot.config;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class NotificationSettings {

    Duration cooldown;

    /** Blank means notifications are only logged. */
    String slackWebhookUrl;

    public boolean isSlackEnabled() {
        return slackWebhookUrl != null && !slackWebhookUrl.isBlank();
    }
}
