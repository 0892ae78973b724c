package com.autopilot.notification;

import com.autopilot.config.NotificationSettings;
import com.autopilot.domain.enums.AdapterName;
import com.autopilot.domain.enums.AlertSeverity;
import com.autopilot.exception.AdapterException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Posts alerts to a Slack incoming webhook. With no webhook configured the alert is only logged.
 *
 * <p>4xx responses (bad webhook, revoked app) are permanent failures; anything else is transient.
 */
public class SlackNotifier implements NotificationAdapter {

    private static final Logger log = LoggerFactory.getLogger(SlackNotifier.class);

    private final NotificationSettings notificationSettings;
    private final RestTemplate restTemplate;

    public SlackNotifier(NotificationSettings notificationSettings, RestTemplate restTemplate) {
        this.notificationSettings = notificationSettings;
        this.restTemplate = restTemplate;
    }

    @Override
    public void notify(AlertSeverity severity, String message) {
        String text = prefix(severity) + message;
        if (!notificationSettings.isSlackEnabled()) {
            log.info("[alert] {}", text);
            return;
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            restTemplate.postForEntity(
                    notificationSettings.getSlackWebhookUrl(), new HttpEntity<>(Map.of("text", text), headers), String.class);
        } catch (HttpClientErrorException e) {
            throw new AdapterException(AdapterName.NOTIFICATION, "Slack rejected alert: " + e.getStatusCode(), false, e);
        } catch (RestClientException e) {
            throw new AdapterException(AdapterName.NOTIFICATION, "Slack unreachable: " + e.getMessage(), true, e);
        }
    }

    private static String prefix(AlertSeverity severity) {
        return switch (severity) {
            case CRITICAL -> ":rotating_light: ";
            case WARNING -> ":warning: ";
            case INFO -> "";
        };
    }
}
