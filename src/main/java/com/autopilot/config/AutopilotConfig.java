package com.autopilot.config;

import com.autopilot.broker.BrokerAdapter;
import com.autopilot.candidate.CandidateSource;
import com.autopilot.candidate.ConfiguredCandidateSource;
import com.autopilot.core.engine.AccountRegistry;
import com.autopilot.domain.enums.TradingMode;
import com.autopilot.domain.model.Candidate;
import com.autopilot.exception.ConfigurationException;
import com.autopilot.notification.NotificationAdapter;
import com.autopilot.notification.SlackNotifier;
import com.autopilot.simulator.PaperBrokerAdapter;
import com.autopilot.strategy.ScoreThresholdStrategy;
import com.autopilot.strategy.TradingStrategy;
import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Converts the bound {@link AutopilotProperties} into the immutable settings handed to components,
 * validates the startup invariants, and provides the paper-mode collaborators.
 *
 * <p>Any {@link ConfigurationException} thrown here aborts context startup.
 */
@Configuration
public class AutopilotConfig {

    private static final Logger log = LoggerFactory.getLogger(AutopilotConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TradingSettings tradingSettings(AutopilotProperties properties) {
        AutopilotProperties.Trading trading = properties.getTrading();
        return TradingSettings.builder()
                .maxTotalExposure(trading.getMaxTotalExposure())
                .stopLossPct(trading.getStopLossPct())
                .takeProfitPct(trading.getTakeProfitPct())
                .maxDayTrades(trading.getMaxDayTrades())
                .maxEntriesPerCycle(trading.getMaxEntriesPerCycle())
                .maxCashFraction(trading.getMaxCashFraction())
                .significantTradeValue(trading.getSignificantTradeValue())
                .build();
    }

    @Bean
    public RiskSettings riskSettings(AutopilotProperties properties) {
        AutopilotProperties.RiskManagement risk = properties.getRiskManagement();
        return RiskSettings.builder()
                .maxDailyLoss(risk.getMaxDailyLoss())
                .kellyEnabled(risk.isKellyEnabled())
                .maxConsecutiveLosses(risk.getMaxConsecutiveLosses())
                .circuitBreakerEnabled(risk.isCircuitBreakerEnabled())
                .failedCyclesBeforeHalt(properties.getScheduler().getFailedCyclesBeforeHalt())
                .performanceMinSamples(risk.getPerformanceMinSamples())
                .performanceWindow(risk.getPerformanceWindow())
                .build();
    }

    @Bean
    public SchedulerSettings schedulerSettings(AutopilotProperties properties) {
        AutopilotProperties.Scheduler scheduler = properties.getScheduler();
        return SchedulerSettings.builder()
                .tradingInterval(scheduler.getTradingInterval())
                .backtestInterval(scheduler.getBacktestInterval())
                .pollInterval(scheduler.getPollInterval())
                .healthCheckInterval(scheduler.getHealthCheckInterval())
                .cycleHistorySize(scheduler.getCycleHistorySize())
                .parallelAccounts(scheduler.isParallelAccounts())
                .backtestSymbolLimit(scheduler.getBacktestSymbolLimit())
                .shutdownTimeout(scheduler.getShutdownTimeout())
                .liquidateOnEmergencyStop(properties.isLiquidateOnEmergencyStop())
                .build();
    }

    @Bean
    public AdapterSettings adapterSettings(AutopilotProperties properties) {
        AutopilotProperties.Adapters adapters = properties.getAdapters();
        return AdapterSettings.builder()
                .callTimeout(adapters.getCallTimeout())
                .maxAttempts(adapters.getMaxAttempts())
                .initialBackoff(adapters.getInitialBackoff())
                .backoffMultiplier(adapters.getBackoffMultiplier())
                .build();
    }

    @Bean
    public NotificationSettings notificationSettings(AutopilotProperties properties) {
        return NotificationSettings.builder()
                .cooldown(properties.getNotifications().getCooldown())
                .slackWebhookUrl(properties.getNotifications().getSlackWebhookUrl())
                .build();
    }

    @Bean
    public AuditSettings auditSettings(AutopilotProperties properties) {
        return AuditSettings.builder()
                .bufferCapacity(properties.getAudit().getBufferCapacity())
                .flushInterval(properties.getAudit().getFlushInterval())
                .build();
    }

    @Bean
    public BacktestSettings backtestSettings(AutopilotProperties properties) {
        return BacktestSettings.builder()
                .strategies(List.copyOf(properties.getBacktest().getStrategies()))
                .notifyReturnThreshold(properties.getBacktest().getNotifyReturnThreshold())
                .build();
    }

    @Bean
    public StrategySettings strategySettings(AutopilotProperties properties) {
        AutopilotProperties.Strategy strategy = properties.getStrategy();
        return StrategySettings.builder()
                .entryScore(strategy.getEntryScore())
                .entryConfidence(strategy.getEntryConfidence())
                .exitScore(strategy.getExitScore())
                .exitConfidence(strategy.getExitConfidence())
                .build();
    }

    @Bean
    public List<AccountSettings> accountSettings(AutopilotProperties properties) {
        return toAccountSettings(properties);
    }

    /**
     * Owns every {@link com.autopilot.domain.model.Account} for the life of the process. Built
     * after LIVE-mode prerequisites are checked, so a misconfigured LIVE deployment never starts.
     */
    @Bean
    public AccountRegistry accountRegistry(
            AutopilotProperties properties,
            List<AccountSettings> accountSettings,
            ObjectProvider<BrokerAdapter> brokerAdapter) {
        if (properties.getTradingMode() == TradingMode.LIVE && brokerAdapter.getIfAvailable() == null) {
            throw new ConfigurationException("trading-mode LIVE requires a BrokerAdapter bean");
        }
        log.info(
                "Managing {} account(s) in {} mode: {}",
                accountSettings.size(),
                properties.getTradingMode(),
                accountSettings.stream().map(AccountSettings::getAccountId).toList());
        return new AccountRegistry(accountSettings);
    }

    // ==================== Paper-mode collaborators ====================

    @Bean
    @ConditionalOnProperty(prefix = "autopilot", name = "trading-mode", havingValue = "PAPER", matchIfMissing = true)
    public BrokerAdapter paperBrokerAdapter(
            AutopilotProperties properties, List<AccountSettings> accountSettings, Clock clock) {
        log.info("Using paper broker with {} configured quote(s)", properties.getPaper().getPrices().size());
        return new PaperBrokerAdapter(accountSettings, properties.getPaper().getPrices(), clock);
    }

    @Bean
    @ConditionalOnMissingBean(CandidateSource.class)
    public CandidateSource configuredCandidateSource(AutopilotProperties properties) {
        List<Candidate> candidates = properties.getCandidates().getStaticList().stream()
                .map(c -> Candidate.builder()
                        .symbol(c.getSymbol())
                        .score(c.getScore())
                        .confidence(c.getConfidence())
                        .kellyFraction(c.getKellyFraction())
                        .build())
                .toList();
        return new ConfiguredCandidateSource(candidates);
    }

    @Bean
    @ConditionalOnMissingBean(TradingStrategy.class)
    public TradingStrategy scoreThresholdStrategy(StrategySettings strategySettings) {
        return new ScoreThresholdStrategy(strategySettings);
    }

    @Bean
    @ConditionalOnMissingBean(NotificationAdapter.class)
    public NotificationAdapter slackNotifier(NotificationSettings notificationSettings) {
        return new SlackNotifier(notificationSettings, new RestTemplate());
    }

    // ==================== Validation ====================

    static List<AccountSettings> toAccountSettings(AutopilotProperties properties) {
        if (!properties.isAccountIsolation()) {
            throw new ConfigurationException("account-isolation=false is not supported; accounts are always isolated");
        }
        Set<String> seen = new HashSet<>();
        for (AutopilotProperties.Account account : properties.getAccounts()) {
            if (!seen.add(account.getId())) {
                throw new ConfigurationException("Duplicate account id: " + account.getId());
            }
        }

        List<AccountSettings> settings = properties.getAccounts().stream()
                .map(account -> AccountSettings.builder()
                        .accountId(account.getId())
                        .startingEquity(account.getStartingEquity())
                        .maxPositionSize(account.getMaxPositionSize())
                        .aggressiveSizingEnabled(account.isAggressiveSizingEnabled())
                        .riskMultiplier(account.getRiskMultiplier())
                        .dailyLossLimit(account.getDailyLossLimit() != null
                                ? account.getDailyLossLimit()
                                : properties.getRiskManagement().getMaxDailyLoss())
                        .apiKeyId(account.getApiKeyId())
                        .apiSecret(account.getApiSecret())
                        .build())
                .toList();

        if (properties.getTradingMode() == TradingMode.LIVE) {
            for (AccountSettings account : settings) {
                if (!account.hasCredentials()) {
                    throw new ConfigurationException(
                            "Missing broker credentials for account " + account.getAccountId());
                }
            }
        }
        return settings;
    }
}
