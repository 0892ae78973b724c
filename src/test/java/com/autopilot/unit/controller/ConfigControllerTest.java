package com.autopilot.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.autopilot.api.controller.ConfigController;
import com.autopilot.config.AccountSettings;
import com.autopilot.config.AdapterSettings;
import com.autopilot.config.AuditSettings;
import com.autopilot.config.BacktestSettings;
import com.autopilot.config.NotificationSettings;
import com.autopilot.config.RiskSettings;
import com.autopilot.config.SchedulerSettings;
import com.autopilot.config.StrategySettings;
import com.autopilot.config.TradingSettings;
import com.autopilot.exception.GlobalExceptionHandler;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/** Unit tests for ConfigController: effective settings with secrets masked. */
class ConfigControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ConfigController controller = new ConfigController(
                TradingSettings.builder().maxTotalExposure(new BigDecimal("0.75")).maxDayTrades(3).build(),
                RiskSettings.builder().maxDailyLoss(new BigDecimal("0.03")).circuitBreakerEnabled(true).build(),
                SchedulerSettings.builder().tradingInterval(Duration.ofMinutes(5)).build(),
                AdapterSettings.builder().callTimeout(Duration.ofSeconds(10)).maxAttempts(3).build(),
                AuditSettings.builder().bufferCapacity(10000).flushInterval(Duration.ofSeconds(2)).build(),
                BacktestSettings.builder().strategies(List.of("PPO")).build(),
                StrategySettings.builder().entryScore(75).build(),
                NotificationSettings.builder()
                        .cooldown(Duration.ofMinutes(15))
                        .slackWebhookUrl("https://hooks.slack.test/services/T000/B000/SECRET")
                        .build(),
                List.of(AccountSettings.builder()
                        .accountId("aggressive")
                        .startingEquity(new BigDecimal("30000"))
                        .maxPositionSize(new BigDecimal("0.15"))
                        .riskMultiplier(new BigDecimal("1.5"))
                        .dailyLossLimit(new BigDecimal("0.05"))
                        .apiKeyId("PKTEST1234ABCD")
                        .apiSecret("very-secret-value")
                        .build()));
        ReflectionTestUtils.setField(controller, "tradingMode", "PAPER");
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void getConfig_returnsEffectiveSettings() throws Exception {
        mockMvc.perform(get("/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tradingMode").value("PAPER"))
                .andExpect(jsonPath("$.trading.maxDayTrades").value(3))
                .andExpect(jsonPath("$.riskManagement.circuitBreakerEnabled").value(true))
                .andExpect(jsonPath("$.accounts[0].id").value("aggressive"))
                .andExpect(jsonPath("$.accounts[0].effectiveRiskMultiplier").value(1))
                .andExpect(jsonPath("$.accounts[0].credentialsConfigured").value(true));
    }

    @Test
    void getConfig_masksSecrets() throws Exception {
        String body = mockMvc.perform(get("/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accounts[0].apiKeyId").value("****ABCD"))
                .andExpect(jsonPath("$.notifications.slackEnabled").value(true))
                .andExpect(jsonPath("$.notifications.slackWebhookUrl").value("****"))
                .andReturn()
                .getResponse()
                .getContentAsString();

        assertThat(body).doesNotContain("very-secret-value").doesNotContain("SECRET").doesNotContain("PKTEST");
    }

    @Test
    void getConfig_isJson() throws Exception {
        mockMvc.perform(get("/config")).andExpect(content().contentTypeCompatibleWith("application/json"));
    }
}
