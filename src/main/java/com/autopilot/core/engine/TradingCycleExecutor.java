package com.autopilot.core.engine;

import com.autopilot.adapter.AdapterCallGuard;
import com.autopilot.audit.BufferedAuditWriter;
import com.autopilot.broker.BrokerAdapter;
import com.autopilot.candidate.CandidateCache;
import com.autopilot.config.SchedulerSettings;
import com.autopilot.domain.enums.AccountStepStatus;
import com.autopilot.domain.enums.AdapterName;
import com.autopilot.domain.enums.OperatingMode;
import com.autopilot.domain.enums.OrderType;
import com.autopilot.domain.model.Account;
import com.autopilot.domain.model.AccountBalance;
import com.autopilot.domain.model.AccountCycleOutcome;
import com.autopilot.domain.model.Candidate;
import com.autopilot.domain.model.CandidateAction;
import com.autopilot.domain.model.CycleResult;
import com.autopilot.domain.model.OrderAudit;
import com.autopilot.domain.model.OrderReceipt;
import com.autopilot.domain.model.Position;
import com.autopilot.event.TradeExecutedEvent;
import com.autopilot.exception.AdapterException;
import com.autopilot.risk.AdmissionDecision;
import com.autopilot.risk.RejectReason;
import com.autopilot.risk.RiskEngine;
import com.autopilot.strategy.TradingStrategy;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Runs one TRADING cycle over every managed account.
 *
 * <p>Per account, in order:
 * <ol>
 *   <li>refresh balance and positions from the broker, then quotes for held and candidate symbols</li>
 *   <li>if the circuit breaker is OPEN, stop here and report the account as HALTED</li>
 *   <li>protective exits (stop-loss / take-profit), then the strategy's actions</li>
 *   <li>admit each action through the {@link RiskEngine}</li>
 *   <li>submit admitted orders to the broker, one at a time</li>
 *   <li>evaluate the circuit breaker and record the account's outcome</li>
 * </ol>
 *
 * <p>Every exception is caught at the account boundary and recorded in that account's
 * {@link AccountCycleOutcome}. A stop request is honoured between accounts: accounts not yet
 * started are reported as CANCELLED, an account already in progress finishes its step.
 */
@Component
public class TradingCycleExecutor {

    private static final Logger log = LoggerFactory.getLogger(TradingCycleExecutor.class);

    private final AccountRegistry accountRegistry;
    private final BrokerAdapter brokerAdapter;
    private final CandidateCache candidateCache;
    private final TradingStrategy tradingStrategy;
    private final RiskEngine riskEngine;
    private final AdapterCallGuard adapterCallGuard;
    private final BufferedAuditWriter bufferedAuditWriter;
    private final SchedulerSettings schedulerSettings;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final ExecutorService accountExecutor;
    private final Clock clock;

    public TradingCycleExecutor(
            AccountRegistry accountRegistry,
            BrokerAdapter brokerAdapter,
            CandidateCache candidateCache,
            TradingStrategy tradingStrategy,
            RiskEngine riskEngine,
            AdapterCallGuard adapterCallGuard,
            BufferedAuditWriter bufferedAuditWriter,
            SchedulerSettings schedulerSettings,
            ApplicationEventPublisher applicationEventPublisher,
            @Qualifier("accountExecutor") ExecutorService accountExecutor,
            Clock clock) {
        this.accountRegistry = accountRegistry;
        this.brokerAdapter = brokerAdapter;
        this.candidateCache = candidateCache;
        this.tradingStrategy = tradingStrategy;
        this.riskEngine = riskEngine;
        this.adapterCallGuard = adapterCallGuard;
        this.bufferedAuditWriter = bufferedAuditWriter;
        this.schedulerSettings = schedulerSettings;
        this.applicationEventPublisher = applicationEventPublisher;
        this.accountExecutor = accountExecutor;
        this.clock = clock;
    }

    public CycleResult execute(long sequence, BooleanSupplier stopRequested) {
        Instant startedAt = clock.instant();
        CycleResult.CycleResultBuilder result =
                CycleResult.builder().sequence(sequence).mode(OperatingMode.TRADING).startedAt(startedAt);

        List<Candidate> candidates = List.of();
        boolean anyActive = accountRegistry.all().stream().anyMatch(a -> !a.getRiskState().isHalted());
        if (anyActive) {
            try {
                candidates = candidateCache.forCycle(sequence);
            } catch (AdapterException e) {
                log.warn("Candidate source unavailable for cycle {}: {}", sequence, e.getMessage());
                result.error("candidates: " + e.getMessage());
            }
        }

        List<AccountCycleOutcome> outcomes = schedulerSettings.isParallelAccounts()
                ? runParallel(sequence, candidates, stopRequested)
                : runSequential(sequence, candidates, stopRequested);

        return result.accountOutcomes(outcomes)
                .cancelled(stopRequested.getAsBoolean())
                .finishedAt(clock.instant())
                .build();
    }

    private List<AccountCycleOutcome> runSequential(
            long sequence, List<Candidate> candidates, BooleanSupplier stopRequested) {
        List<AccountCycleOutcome> outcomes = new ArrayList<>();
        for (Account account : accountRegistry.all()) {
            outcomes.add(stopRequested.getAsBoolean()
                    ? cancelled(account)
                    : processAccount(account, sequence, candidates, stopRequested));
        }
        return outcomes;
    }

    private List<AccountCycleOutcome> runParallel(
            long sequence, List<Candidate> candidates, BooleanSupplier stopRequested) {
        List<Account> accounts = new ArrayList<>(accountRegistry.all());
        List<Future<AccountCycleOutcome>> futures = new ArrayList<>();
        for (Account account : accounts) {
            futures.add(accountExecutor.submit(() -> stopRequested.getAsBoolean()
                    ? cancelled(account)
                    : processAccount(account, sequence, candidates, stopRequested)));
        }

        List<AccountCycleOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            Account account = accounts.get(i);
            try {
                outcomes.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcomes.add(failed(account, "interrupted while waiting for account step"));
            } catch (ExecutionException e) {
                log.error("Account step for {} escaped its error boundary", account.getAccountId(), e.getCause());
                outcomes.add(failed(account, String.valueOf(e.getCause())));
            }
        }
        return outcomes;
    }

    // ==================== Account step ====================

    AccountCycleOutcome processAccount(
            Account account, long sequence, List<Candidate> candidates, BooleanSupplier stopRequested) {
        StepTally tally = new StepTally();
        AccountCycleOutcome.AccountCycleOutcomeBuilder outcome =
                AccountCycleOutcome.builder().accountId(account.getAccountId());
        try {
            riskEngine.beginCycle(account);
            Map<String, BigDecimal> prices = refresh(account, candidates);

            if (account.getRiskState().isHalted()) {
                log.debug("Skipping order flow for halted account {}", account.getAccountId());
                riskEngine.recordCycleHealth(account, false, clock.instant());
                return tally.into(outcome, AccountStepStatus.HALTED);
            }

            Set<String> exited = new HashSet<>();
            for (CandidateAction exit : riskEngine.protectiveExits(account)) {
                exited.add(exit.getSymbol());
                processAction(account, exit, sequence, tally, stopRequested);
            }
            for (CandidateAction action : tradingStrategy.evaluate(account, candidates, prices)) {
                if (exited.contains(action.getSymbol())) {
                    continue;
                }
                processAction(account, action, sequence, tally, stopRequested);
            }

            Instant now = clock.instant();
            riskEngine.evaluateCircuitBreaker(account, now);
            riskEngine.recordCycleHealth(account, false, now);
            return tally.into(outcome, AccountStepStatus.COMPLETED);
        } catch (AdapterException e) {
            log.warn("Account step failed for {}: {}", account.getAccountId(), e.getMessage());
            tally.errors.add(e.getAdapter() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error in account step for {}", account.getAccountId(), e);
            tally.errors.add("unexpected: " + e);
        }
        riskEngine.recordCycleHealth(account, true, clock.instant());
        return tally.into(outcome, AccountStepStatus.FAILED);
    }

    private Map<String, BigDecimal> refresh(Account account, List<Candidate> candidates) {
        String accountId = account.getAccountId();
        AccountBalance balance = adapterCallGuard.call(
                AdapterName.BROKER, "getAccountSummary", () -> brokerAdapter.getAccountSummary(accountId));
        List<Position> positions =
                adapterCallGuard.call(AdapterName.BROKER, "getPositions", () -> brokerAdapter.getPositions(accountId));
        account.applyBrokerState(balance, positions, clock.instant());

        Set<String> symbols = new LinkedHashSet<>(account.heldSymbols());
        candidates.forEach(c -> symbols.add(c.getSymbol()));
        if (symbols.isEmpty()) {
            return Map.of();
        }
        Map<String, BigDecimal> prices =
                adapterCallGuard.call(AdapterName.MARKET_DATA, "getPrices", () -> brokerAdapter.getPrices(symbols));
        account.applyPrices(prices);
        return prices;
    }

    /**
     * Admits and submits one action. Once an emergency stop is raised no further action is admitted,
     * even before the scheduler latches the breakers; an order already at the broker completes.
     */
    private void processAction(
            Account account, CandidateAction action, long sequence, StepTally tally, BooleanSupplier stopRequested) {
        String accountId = account.getAccountId();
        AdmissionDecision decision = stopRequested.getAsBoolean()
                ? AdmissionDecision.reject(RejectReason.ACCOUNT_HALTED)
                : riskEngine.admit(account, action, clock.instant());
        OrderAudit.OrderAuditBuilder audit = OrderAudit.builder()
                .cycleSequence(sequence)
                .accountId(accountId)
                .symbol(action.getSymbol())
                .side(decision.isRejected() ? action.getSide() : decision.getSide())
                .requestedQuantity(action.getQuantity())
                .admittedQuantity(decision.getQuantity())
                .price(action.getReferencePrice())
                .exitTrigger(action.getExitTrigger());

        if (decision.isRejected()) {
            tally.rejected++;
            tally.rejections.add(action.getSymbol() + ": " + decision.getRejectReason().getMessage());
            bufferedAuditWriter.recordOrder(audit.outcome(OrderAudit.Outcome.REJECTED)
                    .reason(decision.getRejectReason().getMessage())
                    .at(clock.instant())
                    .build());
            return;
        }

        tally.attempted++;
        OrderReceipt receipt;
        try {
            receipt = adapterCallGuard.callOnce(
                    AdapterName.BROKER,
                    "submitOrder",
                    () -> brokerAdapter.submitOrder(
                            accountId,
                            action.getSymbol(),
                            decision.getSide(),
                            decision.getQuantity(),
                            OrderType.MARKET));
        } catch (AdapterException e) {
            tally.failed++;
            tally.errors.add("submitOrder " + action.getSymbol() + ": " + e.getMessage());
            log.warn("Order submission failed for {} {} {}: {}",
                    accountId, decision.getSide(), action.getSymbol(), e.getMessage());
            bufferedAuditWriter.recordOrder(audit.outcome(OrderAudit.Outcome.FAILED)
                    .reason(e.getMessage())
                    .at(clock.instant())
                    .build());
            return;
        }

        Instant now = clock.instant();
        BigDecimal realized = riskEngine.recordExecution(account, action, decision, receipt, now);
        OrderAudit record = audit.orderId(receipt.getOrderId())
                .outcome(receipt.isFilled() ? OrderAudit.Outcome.FILLED : OrderAudit.Outcome.ACCEPTED)
                .price(receipt.isFilled() ? receipt.getAveragePrice() : action.getReferencePrice())
                .reason(decision.describe())
                .at(now)
                .build();
        bufferedAuditWriter.recordOrder(record);

        if (receipt.isFilled()) {
            tally.filled++;
            log.info(
                    "Filled {} {} {} x{} @ {} for {}{}",
                    action.getType(),
                    decision.getSide(),
                    action.getSymbol(),
                    receipt.getFilledQuantity(),
                    receipt.getAveragePrice(),
                    accountId,
                    realized.signum() != 0 ? " (realized " + realized + ")" : "");
            applicationEventPublisher.publishEvent(new TradeExecutedEvent(this, record));
        } else {
            log.info("Order {} accepted for {} {} {} x{}",
                    receipt.getOrderId(), accountId, decision.getSide(), action.getSymbol(), decision.getQuantity());
        }
    }

    private AccountCycleOutcome cancelled(Account account) {
        return AccountCycleOutcome.builder()
                .accountId(account.getAccountId())
                .status(AccountStepStatus.CANCELLED)
                .build();
    }

    private AccountCycleOutcome failed(Account account, String error) {
        return AccountCycleOutcome.builder()
                .accountId(account.getAccountId())
                .status(AccountStepStatus.FAILED)
                .error(error)
                .build();
    }

    /** Counters for one account step; kept outside the builder so partial progress survives a failure. */
    private static class StepTally {

        private int attempted;
        private int filled;
        private int rejected;
        private int failed;
        private final List<String> errors = new ArrayList<>();
        private final List<String> rejections = new ArrayList<>();

        private AccountCycleOutcome into(
                AccountCycleOutcome.AccountCycleOutcomeBuilder builder, AccountStepStatus status) {
            return builder.status(status)
                    .ordersAttempted(attempted)
                    .ordersFilled(filled)
                    .ordersRejected(rejected)
                    .ordersFailed(failed)
                    .errors(errors)
                    .rejections(rejections)
                    .build();
        }
    }
}
