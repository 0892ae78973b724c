package com.autopilot.api.dto.response;

import com.autopilot.config.AdapterSettings;
import com.autopilot.config.AuditSettings;
import com.autopilot.config.BacktestSettings;
import com.autopilot.config.RiskSettings;
import com.autopilot.config.SchedulerSettings;
import com.autopilot.config.StrategySettings;
import com.autopilot.config.TradingSettings;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Effective configuration returned by GET /config. Credentials and the webhook URL are masked;
 * settings objects without secrets are exposed as-is.
 */
@Getter
@Builder
public class ConfigResponse {

    private final String tradingMode;
    private final TradingSettings trading;
    private final RiskSettings riskManagement;
    private final SchedulerSettings scheduler;
    private final AdapterSettings adapters;
    private final AuditSettings audit;
    private final BacktestSettings backtest;
    private final StrategySettings strategy;
    private final NotificationConfig notifications;
    private final List<AccountConfig> accounts;

    @Getter
    @Builder
    public static class NotificationConfig {
        private final Duration cooldown;
        private final boolean slackEnabled;
        private final String slackWebhookUrl;
    }

    @Getter
    @Builder
    public static class AccountConfig {
        private final String id;
        private final BigDecimal startingEquity;
        private final BigDecimal maxPositionSize;
        private final boolean aggressiveSizingEnabled;
        private final BigDecimal riskMultiplier;
        private final BigDecimal effectiveRiskMultiplier;
        private final BigDecimal dailyLossLimit;
        private final String apiKeyId;
        private final boolean credentialsConfigured;
    }
}
