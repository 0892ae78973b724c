package com.autopilot.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.autopilot.config.AccountSettings;
import com.autopilot.config.RiskSettings;
import com.autopilot.config.SchedulerSettings;
import com.autopilot.domain.enums.OperatingMode;
import com.autopilot.domain.enums.OrderSide;
import com.autopilot.domain.model.Account;
import com.autopilot.domain.model.CycleResult;
import com.autopilot.observability.AccountSnapshot;
import com.autopilot.observability.PositionSnapshot;
import com.autopilot.observability.SnapshotPublisher;
import com.autopilot.observability.SystemSnapshot;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for SnapshotPublisher: cycle history bounds, equity sampling and consistent reads. */
class SnapshotPublisherTest {

    private static final Instant T0 = Instant.parse("2026-03-11T15:00:00Z");

    private SnapshotPublisher publisher;
    private Account account;

    @BeforeEach
    void setUp() {
        publisher = new SnapshotPublisher(
                SchedulerSettings.builder()
                        .tradingInterval(Duration.ofMinutes(5))
                        .backtestInterval(Duration.ofMinutes(30))
                        .pollInterval(Duration.ofSeconds(1))
                        .healthCheckInterval(Duration.ofSeconds(60))
                        .cycleHistorySize(3)
                        .backtestSymbolLimit(5)
                        .shutdownTimeout(Duration.ofSeconds(5))
                        .build(),
                RiskSettings.builder()
                        .maxDailyLoss(new BigDecimal("0.03"))
                        .maxConsecutiveLosses(5)
                        .circuitBreakerEnabled(true)
                        .failedCyclesBeforeHalt(3)
                        .performanceMinSamples(2)
                        .performanceWindow(252)
                        .build());
        account = new Account(AccountSettings.builder()
                .accountId("acct-1")
                .startingEquity(new BigDecimal("100000"))
                .maxPositionSize(new BigDecimal("0.15"))
                .riskMultiplier(BigDecimal.ONE)
                .dailyLossLimit(new BigDecimal("0.03"))
                .build());
    }

    private static CycleResult cycle(long sequence, OperatingMode mode) {
        Instant started = T0.plusSeconds(sequence * 300);
        return CycleResult.builder()
                .sequence(sequence)
                .mode(mode)
                .startedAt(started)
                .finishedAt(started.plusMillis(100))
                .build();
    }

    @Test
    @DisplayName("Initial snapshot has sequence zero and no cycles")
    void initialSnapshot() {
        publisher.publishInitial(List.of(account), OperatingMode.TRADING, T0);

        SystemSnapshot snapshot = publisher.current();
        assertThat(snapshot.getCycleSequence()).isZero();
        assertThat(snapshot.getMode()).isEqualTo(OperatingMode.TRADING);
        assertThat(snapshot.getLastCycleAt()).isNull();
        assertThat(snapshot.getAccounts()).singleElement().satisfies(a -> {
            assertThat(a.getEquity()).isEqualByComparingTo("100000");
            assertThat(a.getPerformance().getSampleCount()).isZero();
        });
    }

    @Test
    @DisplayName("Cycle history keeps only the most recent cycles, oldest first")
    void historyBounded() {
        for (long sequence = 1; sequence <= 5; sequence++) {
            publisher.publish(cycle(sequence, OperatingMode.TRADING), List.of(account));
        }

        assertThat(publisher.current().getRecentCycles())
                .extracting(CycleResult::getSequence)
                .containsExactly(3L, 4L, 5L);
    }

    @Test
    @DisplayName("Only trading cycles add equity samples")
    void backtestCyclesDoNotSample() {
        publisher.publish(cycle(1, OperatingMode.TRADING), List.of(account));
        publisher.publish(cycle(2, OperatingMode.BACKTESTING), List.of(account));
        publisher.publish(cycle(3, OperatingMode.BACKTESTING), List.of(account));
        publisher.publish(cycle(4, OperatingMode.TRADING), List.of(account));

        AccountSnapshot snapshot = publisher.current().getAccounts().get(0);
        assertThat(snapshot.getPerformance().getSampleCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Republish keeps the cycle sequence and reflects the latest account state")
    void republishKeepsSequence() {
        publisher.publish(cycle(7, OperatingMode.TRADING), List.of(account));
        account.applyFill("AAPL", OrderSide.BUY, 10, new BigDecimal("100"), T0);

        publisher.republish(List.of(account), T0.plusSeconds(5000));

        SystemSnapshot snapshot = publisher.current();
        assertThat(snapshot.getCycleSequence()).isEqualTo(7);
        assertThat(snapshot.getAccounts().get(0).getOpenPositions()).isEqualTo(1);
    }

    @Test
    @DisplayName("Concurrent readers never observe a partially updated snapshot")
    void noTornReads() throws InterruptedException {
        publisher.publishInitial(List.of(account), OperatingMode.TRADING, T0);
        AtomicBoolean done = new AtomicBoolean();
        AtomicInteger reads = new AtomicInteger();
        ConcurrentLinkedQueue<String> violations = new ConcurrentLinkedQueue<>();

        Runnable reader = () -> {
            while (!done.get()) {
                SystemSnapshot snapshot = publisher.current();
                for (AccountSnapshot a : snapshot.getAccounts()) {
                    if (a.getCycleSequence() != snapshot.getCycleSequence()) {
                        violations.add("account sequence " + a.getCycleSequence() + " in " + snapshot.getCycleSequence());
                    }
                    if (a.getOpenPositions() != a.getPositions().size()) {
                        violations.add("position count mismatch at " + snapshot.getCycleSequence());
                    }
                    int shares = a.getPositions().stream().mapToInt(PositionSnapshot::getQuantity).sum();
                    if (shares != snapshot.getCycleSequence()) {
                        violations.add("shares " + shares + " at sequence " + snapshot.getCycleSequence());
                    }
                }
                reads.incrementAndGet();
            }
        };
        Thread first = new Thread(reader, "reader-1");
        Thread second = new Thread(reader, "reader-2");
        first.start();
        second.start();

        for (long sequence = 1; sequence <= 2000; sequence++) {
            account.applyFill("AAPL", OrderSide.BUY, 1, new BigDecimal("10"), T0);
            publisher.publish(cycle(sequence, OperatingMode.TRADING), List.of(account));
        }
        done.set(true);
        first.join(5000);
        second.join(5000);

        assertThat(violations).isEmpty();
        assertThat(reads.get()).isPositive();
        assertThat(publisher.current().getCycleSequence()).isEqualTo(2000);
    }
}
