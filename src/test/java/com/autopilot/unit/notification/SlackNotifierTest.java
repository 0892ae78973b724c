package com.autopilot.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.autopilot.config.NotificationSettings;
import com.autopilot.domain.enums.AlertSeverity;
import com.autopilot.exception.AdapterException;
import com.autopilot.notification.SlackNotifier;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class SlackNotifierTest {

    private static final String WEBHOOK = "https://hooks.slack.test/services/T000/B000/XXXX";

    private RestTemplate restTemplate;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
    }

    private SlackNotifier notifier(String webhook) {
        return new SlackNotifier(
                NotificationSettings.builder().cooldown(Duration.ofMinutes(15)).slackWebhookUrl(webhook).build(),
                restTemplate);
    }

    @Test
    @DisplayName("Posts the prefixed text to the webhook")
    void postsToWebhook() {
        server.expect(requestTo(WEBHOOK))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"text\":\":rotating_light: Emergency stop: manual\"}"))
                .andRespond(withSuccess("ok", null));

        notifier(WEBHOOK).notify(AlertSeverity.CRITICAL, "Emergency stop: manual");

        server.verify();
    }

    @Test
    @DisplayName("Blank webhook only logs")
    void disabledOnlyLogs() {
        notifier("").notify(AlertSeverity.INFO, "daily report");

        server.verify();
    }

    @Test
    @DisplayName("A 4xx is a permanent failure, a 5xx a transient one")
    void classifiesFailures() {
        server.expect(requestTo(WEBHOOK)).andRespond(withBadRequest());
        assertThatThrownBy(() -> notifier(WEBHOOK).notify(AlertSeverity.WARNING, "x"))
                .isInstanceOfSatisfying(AdapterException.class, e -> assertThat(e.isTransientFailure()).isFalse());

        server.reset();
        server.expect(requestTo(WEBHOOK)).andRespond(withServerError());
        assertThatThrownBy(() -> notifier(WEBHOOK).notify(AlertSeverity.WARNING, "x"))
                .isInstanceOfSatisfying(AdapterException.class, e -> assertThat(e.isTransientFailure()).isTrue());
    }
}
