package com.autopilot.api.controller;

import com.autopilot.api.dto.response.ConfigResponse;
import com.autopilot.config.AccountSettings;
import com.autopilot.config.AdapterSettings;
import com.autopilot.config.AuditSettings;
import com.autopilot.config.BacktestSettings;
import com.autopilot.config.NotificationSettings;
import com.autopilot.config.RiskSettings;
import com.autopilot.config.SchedulerSettings;
import com.autopilot.config.StrategySettings;
import com.autopilot.config.TradingSettings;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** GET /config: the effective, read-only configuration with secrets masked. */
@RestController
@RequestMapping("/config")
public class ConfigController {

    private static final String MASK = "****";

    private final TradingSettings tradingSettings;
    private final RiskSettings riskSettings;
    private final SchedulerSettings schedulerSettings;
    private final AdapterSettings adapterSettings;
    private final AuditSettings auditSettings;
    private final BacktestSettings backtestSettings;
    private final StrategySettings strategySettings;
    private final NotificationSettings notificationSettings;
    private final List<AccountSettings> accountSettings;

    @Value("${autopilot.trading-mode:PAPER}")
    private String tradingMode;

    public ConfigController(
            TradingSettings tradingSettings,
            RiskSettings riskSettings,
            SchedulerSettings schedulerSettings,
            AdapterSettings adapterSettings,
            AuditSettings auditSettings,
            BacktestSettings backtestSettings,
            StrategySettings strategySettings,
            NotificationSettings notificationSettings,
            List<AccountSettings> accountSettings) {
        this.tradingSettings = tradingSettings;
        this.riskSettings = riskSettings;
        this.schedulerSettings = schedulerSettings;
        this.adapterSettings = adapterSettings;
        this.auditSettings = auditSettings;
        this.backtestSettings = backtestSettings;
        this.strategySettings = strategySettings;
        this.notificationSettings = notificationSettings;
        this.accountSettings = accountSettings;
    }

    @GetMapping
    public ResponseEntity<ConfigResponse> getConfig() {
        return ResponseEntity.ok(ConfigResponse.builder()
                .tradingMode(tradingMode)
                .trading(tradingSettings)
                .riskManagement(riskSettings)
                .scheduler(schedulerSettings)
                .adapters(adapterSettings)
                .audit(auditSettings)
                .backtest(backtestSettings)
                .strategy(strategySettings)
                .notifications(ConfigResponse.NotificationConfig.builder()
                        .cooldown(notificationSettings.getCooldown())
                        .slackEnabled(notificationSettings.isSlackEnabled())
                        .slackWebhookUrl(notificationSettings.isSlackEnabled() ? MASK : "")
                        .build())
                .accounts(accountSettings.stream().map(ConfigController::toAccountConfig).toList())
                .build());
    }

    private static ConfigResponse.AccountConfig toAccountConfig(AccountSettings account) {
        return ConfigResponse.AccountConfig.builder()
                .id(account.getAccountId())
                .startingEquity(account.getStartingEquity())
                .maxPositionSize(account.getMaxPositionSize())
                .aggressiveSizingEnabled(account.isAggressiveSizingEnabled())
                .riskMultiplier(account.getRiskMultiplier())
                .effectiveRiskMultiplier(account.effectiveRiskMultiplier())
                .dailyLossLimit(account.getDailyLossLimit())
                .apiKeyId(mask(account.getApiKeyId()))
                .credentialsConfigured(account.hasCredentials())
                .build();
    }

    /** Keeps the last four characters of values longer than eight. */
    static String mask(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        if (value.length() <= 8) {
            return MASK;
        }
        return MASK + value.substring(value.length() - 4);
    }
}
