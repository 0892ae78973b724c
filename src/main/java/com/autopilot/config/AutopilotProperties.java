package com.autopilot.config;

import com.autopilot.domain.enums.TradingMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Raw binding of the {@code autopilot.*} configuration tree.
 *
 * <p>Unknown keys and constraint violations fail startup. This object is read exactly once, by
 * {@link AutopilotConfig}, which converts it into the immutable settings passed to components.
 */
@Validated
@ConfigurationProperties(prefix = "autopilot", ignoreUnknownFields = false)
public class AutopilotProperties {

    @NotNull
    private TradingMode tradingMode = TradingMode.PAPER;

    private boolean accountIsolation = true;
    private boolean liquidateOnEmergencyStop = false;

    @Valid
    private Scheduler scheduler = new Scheduler();

    @Valid
    private Trading trading = new Trading();

    @Valid
    private RiskManagement riskManagement = new RiskManagement();

    @Valid
    private Adapters adapters = new Adapters();

    @Valid
    private Notifications notifications = new Notifications();

    @Valid
    private Audit audit = new Audit();

    @Valid
    private Backtest backtest = new Backtest();

    @Valid
    private Strategy strategy = new Strategy();

    @Valid
    @NotEmpty
    private List<Account> accounts = new ArrayList<>();

    @Valid
    private Paper paper = new Paper();

    @Valid
    private Candidates candidates = new Candidates();

    public TradingMode getTradingMode() {
        return tradingMode;
    }

    public void setTradingMode(TradingMode tradingMode) {
        this.tradingMode = tradingMode;
    }

    public boolean isAccountIsolation() {
        return accountIsolation;
    }

    public void setAccountIsolation(boolean accountIsolation) {
        this.accountIsolation = accountIsolation;
    }

    public boolean isLiquidateOnEmergencyStop() {
        return liquidateOnEmergencyStop;
    }

    public void setLiquidateOnEmergencyStop(boolean liquidateOnEmergencyStop) {
        this.liquidateOnEmergencyStop = liquidateOnEmergencyStop;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Trading getTrading() {
        return trading;
    }

    public void setTrading(Trading trading) {
        this.trading = trading;
    }

    public RiskManagement getRiskManagement() {
        return riskManagement;
    }

    public void setRiskManagement(RiskManagement riskManagement) {
        this.riskManagement = riskManagement;
    }

    public Adapters getAdapters() {
        return adapters;
    }

    public void setAdapters(Adapters adapters) {
        this.adapters = adapters;
    }

    public Notifications getNotifications() {
        return notifications;
    }

    public void setNotifications(Notifications notifications) {
        this.notifications = notifications;
    }

    public Audit getAudit() {
        return audit;
    }

    public void setAudit(Audit audit) {
        this.audit = audit;
    }

    public Backtest getBacktest() {
        return backtest;
    }

    public void setBacktest(Backtest backtest) {
        this.backtest = backtest;
    }

    public Strategy getStrategy() {
        return strategy;
    }

    public void setStrategy(Strategy strategy) {
        this.strategy = strategy;
    }

    public List<Account> getAccounts() {
        return accounts;
    }

    public void setAccounts(List<Account> accounts) {
        this.accounts = accounts;
    }

    public Paper getPaper() {
        return paper;
    }

    public void setPaper(Paper paper) {
        this.paper = paper;
    }

    public Candidates getCandidates() {
        return candidates;
    }

    public void setCandidates(Candidates candidates) {
        this.candidates = candidates;
    }

    public static class Scheduler {

        @NotNull
        private Duration tradingInterval = Duration.ofMinutes(5);

        @NotNull
        private Duration backtestInterval = Duration.ofMinutes(30);

        @NotNull
        private Duration pollInterval = Duration.ofSeconds(5);

        @NotNull
        private Duration healthCheckInterval = Duration.ofSeconds(60);

        @Min(1)
        private int cycleHistorySize = 100;

        @Min(1)
        private int failedCyclesBeforeHalt = 3;

        private boolean parallelAccounts = false;

        @Min(1)
        private int backtestSymbolLimit = 5;

        @NotNull
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public Duration getTradingInterval() {
            return tradingInterval;
        }

        public void setTradingInterval(Duration tradingInterval) {
            this.tradingInterval = tradingInterval;
        }

        public Duration getBacktestInterval() {
            return backtestInterval;
        }

        public void setBacktestInterval(Duration backtestInterval) {
            this.backtestInterval = backtestInterval;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getHealthCheckInterval() {
            return healthCheckInterval;
        }

        public void setHealthCheckInterval(Duration healthCheckInterval) {
            this.healthCheckInterval = healthCheckInterval;
        }

        public int getCycleHistorySize() {
            return cycleHistorySize;
        }

        public void setCycleHistorySize(int cycleHistorySize) {
            this.cycleHistorySize = cycleHistorySize;
        }

        public int getFailedCyclesBeforeHalt() {
            return failedCyclesBeforeHalt;
        }

        public void setFailedCyclesBeforeHalt(int failedCyclesBeforeHalt) {
            this.failedCyclesBeforeHalt = failedCyclesBeforeHalt;
        }

        public boolean isParallelAccounts() {
            return parallelAccounts;
        }

        public void setParallelAccounts(boolean parallelAccounts) {
            this.parallelAccounts = parallelAccounts;
        }

        public int getBacktestSymbolLimit() {
            return backtestSymbolLimit;
        }

        public void setBacktestSymbolLimit(int backtestSymbolLimit) {
            this.backtestSymbolLimit = backtestSymbolLimit;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    public static class Trading {

        @NotNull
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private BigDecimal maxTotalExposure = new BigDecimal("0.75");

        @NotNull
        @DecimalMin("0.0")
        private BigDecimal stopLossPct = new BigDecimal("0.05");

        @NotNull
        @DecimalMin("0.0")
        private BigDecimal takeProfitPct = new BigDecimal("0.10");

        @Min(0)
        private int maxDayTrades = 3;

        @Min(0)
        private int maxEntriesPerCycle = 2;

        @NotNull
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private BigDecimal maxCashFraction = new BigDecimal("0.80");

        @NotNull
        private BigDecimal significantTradeValue = new BigDecimal("1000");

        public BigDecimal getMaxTotalExposure() {
            return maxTotalExposure;
        }

        public void setMaxTotalExposure(BigDecimal maxTotalExposure) {
            this.maxTotalExposure = maxTotalExposure;
        }

        public BigDecimal getStopLossPct() {
            return stopLossPct;
        }

        public void setStopLossPct(BigDecimal stopLossPct) {
            this.stopLossPct = stopLossPct;
        }

        public BigDecimal getTakeProfitPct() {
            return takeProfitPct;
        }

        public void setTakeProfitPct(BigDecimal takeProfitPct) {
            this.takeProfitPct = takeProfitPct;
        }

        public int getMaxDayTrades() {
            return maxDayTrades;
        }

        public void setMaxDayTrades(int maxDayTrades) {
            this.maxDayTrades = maxDayTrades;
        }

        public int getMaxEntriesPerCycle() {
            return maxEntriesPerCycle;
        }

        public void setMaxEntriesPerCycle(int maxEntriesPerCycle) {
            this.maxEntriesPerCycle = maxEntriesPerCycle;
        }

        public BigDecimal getMaxCashFraction() {
            return maxCashFraction;
        }

        public void setMaxCashFraction(BigDecimal maxCashFraction) {
            this.maxCashFraction = maxCashFraction;
        }

        public BigDecimal getSignificantTradeValue() {
            return significantTradeValue;
        }

        public void setSignificantTradeValue(BigDecimal significantTradeValue) {
            this.significantTradeValue = significantTradeValue;
        }
    }

    public static class RiskManagement {

        @NotNull
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private BigDecimal maxDailyLoss = new BigDecimal("0.03");

        private boolean kellyEnabled = true;

        @Min(1)
        private int maxConsecutiveLosses = 5;

        private boolean circuitBreakerEnabled = true;

        @Min(2)
        private int performanceMinSamples = 30;

        @Min(2)
        private int performanceWindow = 252;

        public BigDecimal getMaxDailyLoss() {
            return maxDailyLoss;
        }

        public void setMaxDailyLoss(BigDecimal maxDailyLoss) {
            this.maxDailyLoss = maxDailyLoss;
        }

        public boolean isKellyEnabled() {
            return kellyEnabled;
        }

        public void setKellyEnabled(boolean kellyEnabled) {
            this.kellyEnabled = kellyEnabled;
        }

        public int getMaxConsecutiveLosses() {
            return maxConsecutiveLosses;
        }

        public void setMaxConsecutiveLosses(int maxConsecutiveLosses) {
            this.maxConsecutiveLosses = maxConsecutiveLosses;
        }

        public boolean isCircuitBreakerEnabled() {
            return circuitBreakerEnabled;
        }

        public void setCircuitBreakerEnabled(boolean circuitBreakerEnabled) {
            this.circuitBreakerEnabled = circuitBreakerEnabled;
        }

        public int getPerformanceMinSamples() {
            return performanceMinSamples;
        }

        public void setPerformanceMinSamples(int performanceMinSamples) {
            this.performanceMinSamples = performanceMinSamples;
        }

        public int getPerformanceWindow() {
            return performanceWindow;
        }

        public void setPerformanceWindow(int performanceWindow) {
            this.performanceWindow = performanceWindow;
        }
    }

    public static class Adapters {

        @NotNull
        private Duration callTimeout = Duration.ofSeconds(10);

        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration initialBackoff = Duration.ofMillis(500);

        @DecimalMin("1.0")
        private double backoffMultiplier = 2.0;

        public Duration getCallTimeout() {
            return callTimeout;
        }

        public void setCallTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }
    }

    public static class Notifications {

        @NotNull
        private Duration cooldown = Duration.ofMinutes(15);

        private String slackWebhookUrl = "";

        public Duration getCooldown() {
            return cooldown;
        }

        public void setCooldown(Duration cooldown) {
            this.cooldown = cooldown;
        }

        public String getSlackWebhookUrl() {
            return slackWebhookUrl;
        }

        public void setSlackWebhookUrl(String slackWebhookUrl) {
            this.slackWebhookUrl = slackWebhookUrl;
        }
    }

    public static class Audit {

        @Min(1)
        private int bufferCapacity = 1000;

        @NotNull
        private Duration flushInterval = Duration.ofSeconds(5);

        public int getBufferCapacity() {
            return bufferCapacity;
        }

        public void setBufferCapacity(int bufferCapacity) {
            this.bufferCapacity = bufferCapacity;
        }

        public Duration getFlushInterval() {
            return flushInterval;
        }

        public void setFlushInterval(Duration flushInterval) {
            this.flushInterval = flushInterval;
        }
    }

    public static class Backtest {

        @NotEmpty
        private List<String> strategies = new ArrayList<>(List.of("PPO", "V9B_MOMENTUM", "MEAN_REVERSION"));

        @NotNull
        private BigDecimal notifyReturnThreshold = new BigDecimal("0.05");

        public List<String> getStrategies() {
            return strategies;
        }

        public void setStrategies(List<String> strategies) {
            this.strategies = strategies;
        }

        public BigDecimal getNotifyReturnThreshold() {
            return notifyReturnThreshold;
        }

        public void setNotifyReturnThreshold(BigDecimal notifyReturnThreshold) {
            this.notifyReturnThreshold = notifyReturnThreshold;
        }
    }

    public static class Strategy {

        @Min(0)
        private int entryScore = 75;

        @Min(0)
        private int entryConfidence = 9;

        @Min(0)
        private int exitScore = 60;

        @Min(0)
        private int exitConfidence = 6;

        public int getEntryScore() {
            return entryScore;
        }

        public void setEntryScore(int entryScore) {
            this.entryScore = entryScore;
        }

        public int getEntryConfidence() {
            return entryConfidence;
        }

        public void setEntryConfidence(int entryConfidence) {
            this.entryConfidence = entryConfidence;
        }

        public int getExitScore() {
            return exitScore;
        }

        public void setExitScore(int exitScore) {
            this.exitScore = exitScore;
        }

        public int getExitConfidence() {
            return exitConfidence;
        }

        public void setExitConfidence(int exitConfidence) {
            this.exitConfidence = exitConfidence;
        }
    }

    public static class Account {

        @NotBlank
        private String id;

        @NotNull
        @Positive
        private BigDecimal startingEquity;

        @NotNull
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private BigDecimal maxPositionSize = new BigDecimal("0.15");

        private boolean aggressiveSizingEnabled = false;

        @NotNull
        @DecimalMin("0.0")
        private BigDecimal riskMultiplier = BigDecimal.ONE;

        /** Fraction of session-start equity; falls back to risk-management.max-daily-loss when unset. */
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private BigDecimal dailyLossLimit;

        private String apiKeyId;
        private String apiSecret;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public BigDecimal getStartingEquity() {
            return startingEquity;
        }

        public void setStartingEquity(BigDecimal startingEquity) {
            this.startingEquity = startingEquity;
        }

        public BigDecimal getMaxPositionSize() {
            return maxPositionSize;
        }

        public void setMaxPositionSize(BigDecimal maxPositionSize) {
            this.maxPositionSize = maxPositionSize;
        }

        public boolean isAggressiveSizingEnabled() {
            return aggressiveSizingEnabled;
        }

        public void setAggressiveSizingEnabled(boolean aggressiveSizingEnabled) {
            this.aggressiveSizingEnabled = aggressiveSizingEnabled;
        }

        public BigDecimal getRiskMultiplier() {
            return riskMultiplier;
        }

        public void setRiskMultiplier(BigDecimal riskMultiplier) {
            this.riskMultiplier = riskMultiplier;
        }

        public BigDecimal getDailyLossLimit() {
            return dailyLossLimit;
        }

        public void setDailyLossLimit(BigDecimal dailyLossLimit) {
            this.dailyLossLimit = dailyLossLimit;
        }

        public String getApiKeyId() {
            return apiKeyId;
        }

        public void setApiKeyId(String apiKeyId) {
            this.apiKeyId = apiKeyId;
        }

        public String getApiSecret() {
            return apiSecret;
        }

        public void setApiSecret(String apiSecret) {
            this.apiSecret = apiSecret;
        }
    }

    public static class Paper {

        private Map<String, BigDecimal> prices = new LinkedHashMap<>();

        public Map<String, BigDecimal> getPrices() {
            return prices;
        }

        public void setPrices(Map<String, BigDecimal> prices) {
            this.prices = prices;
        }
    }

    public static class Candidates {

        @Valid
        private List<StaticCandidate> staticList = new ArrayList<>();

        public List<StaticCandidate> getStaticList() {
            return staticList;
        }

        public void setStaticList(List<StaticCandidate> staticList) {
            this.staticList = staticList;
        }
    }

    public static class StaticCandidate {

        @NotBlank
        private String symbol;

        private int score;
        private int confidence;

        /** Optional Kelly fraction supplied alongside the score. */
        private BigDecimal kellyFraction;

        public String getSymbol() {
            return symbol;
        }

        public void setSymbol(String symbol) {
            this.symbol = symbol;
        }

        public int getScore() {
            return score;
        }

        public void setScore(int score) {
            this.score = score;
        }

        public int getConfidence() {
            return confidence;
        }

        public void setConfidence(int confidence) {
            this.confidence = confidence;
        }

        public BigDecimal getKellyFraction() {
            return kellyFraction;
        }

        public void setKellyFraction(BigDecimal kellyFraction) {
            this.kellyFraction = kellyFraction;
        }
    }
}
