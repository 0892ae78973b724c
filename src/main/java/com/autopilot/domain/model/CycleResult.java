package com.autopilot.domain.model;

import com.autopilot.domain.enums.OperatingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Immutable outcome of one scheduler iteration. Sequence numbers start at 1 and increase by one
 * per recorded result.
 */
@Value
@Builder
public class CycleResult {

    long sequence;
    OperatingMode mode;
    Instant startedAt;
    Instant finishedAt;

    @Singular
    List<AccountCycleOutcome> accountOutcomes;

    /** Cycle-level errors not attributable to a single account (e.g. candidate source down). */
    @Singular
    List<String> errors;

    /** Set for BACKTESTING cycles that produced at least one result. */
    BacktestResult bestBacktest;

    boolean cancelled;

    public Duration getDuration() {
        return Duration.between(startedAt, finishedAt);
    }

    public int getAccountsProcessed() {
        return accountOutcomes.size();
    }

    public int getOrdersAttempted() {
        return accountOutcomes.stream().mapToInt(AccountCycleOutcome::getOrdersAttempted).sum();
    }

    public int getOrdersFilled() {
        return accountOutcomes.stream().mapToInt(AccountCycleOutcome::getOrdersFilled).sum();
    }

    public int getOrdersRejected() {
        return accountOutcomes.stream().mapToInt(AccountCycleOutcome::getOrdersRejected).sum();
    }

    public int getErrorCount() {
        return errors.size()
                + accountOutcomes.stream().mapToInt(o -> o.getErrors().size()).sum();
    }
}
