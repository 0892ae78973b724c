package com.autopilot.audit;

import com.autopilot.adapter.AdapterCallGuard;
import com.autopilot.config.AuditSettings;
import com.autopilot.domain.enums.AdapterName;
import com.autopilot.domain.model.BacktestResult;
import com.autopilot.domain.model.CircuitBreakerRecord;
import com.autopilot.domain.model.CycleResult;
import com.autopilot.domain.model.DailyReport;
import com.autopilot.domain.model.OrderAudit;
import com.autopilot.event.RiskEvent;
import com.autopilot.event.RiskEventType;
import com.autopilot.exception.AdapterException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fire-and-log front of the {@link PersistenceAdapter}.
 *
 * <p>Producers (the scheduling loop, event listeners) only append to a bounded FIFO and never wait
 * on the database. A scheduled flush drains it in order through {@link AdapterCallGuard}. On failure
 * the head record stays in place and the next attempt is pushed back exponentially, so records are
 * written in the order they were produced. A permanent failure drops the head record instead, so one
 * unwritable record cannot stall the queue. Dropped records, including overflow of a full buffer,
 * are counted.
 */
@Component
public class BufferedAuditWriter {

    private static final Logger log = LoggerFactory.getLogger(BufferedAuditWriter.class);

    private static final Duration MAX_BACKOFF = Duration.ofMinutes(5);

    private final PersistenceAdapter persistenceAdapter;
    private final AdapterCallGuard adapterCallGuard;
    private final AuditSettings auditSettings;
    private final Clock clock;

    private final Deque<PendingRecord> buffer = new ArrayDeque<>();
    private final Object flushLock = new Object();

    private long droppedRecords;
    private int consecutiveFailures;
    private volatile Instant nextAttemptAt = Instant.EPOCH;

    public BufferedAuditWriter(
            PersistenceAdapter persistenceAdapter,
            AdapterCallGuard adapterCallGuard,
            AuditSettings auditSettings,
            Clock clock) {
        this.persistenceAdapter = persistenceAdapter;
        this.adapterCallGuard = adapterCallGuard;
        this.auditSettings = auditSettings;
        this.clock = clock;
    }

    public void recordCycle(CycleResult cycleResult) {
        enqueue("cycle #" + cycleResult.getSequence(), adapter -> adapter.recordCycle(cycleResult));
    }

    public void recordOrder(OrderAudit order) {
        enqueue(
                "order " + order.getAccountId() + " " + order.getSymbol() + " " + order.getOutcome(),
                adapter -> adapter.recordOrder(order));
    }

    public void recordBacktest(BacktestResult result) {
        enqueue("backtest " + result.getStrategy(), adapter -> adapter.recordBacktest(result));
    }

    public void recordDailyReport(DailyReport report) {
        enqueue(
                "daily report " + report.getAccountId() + " " + report.getTradingDate(),
                adapter -> adapter.recordDailyReport(report));
    }

    @EventListener
    public void onRiskEvent(RiskEvent event) {
        if (event.getEventType() == RiskEventType.SESSION_RESET) {
            return;
        }
        CircuitBreakerRecord record = CircuitBreakerRecord.builder()
                .accountId(event.getAccountId())
                .eventType(event.getEventType().name())
                .haltReason(event.getHaltReason() != null ? event.getHaltReason().name() : null)
                .level(event.getLevel().name())
                .message(event.getMessage())
                .details(event.getDetails().toString())
                .at(clock.instant())
                .build();
        enqueue(
                "circuit breaker " + event.getEventType() + " " + event.getAccountId(),
                adapter -> adapter.recordCircuitBreakerEvent(record));
    }

    @Scheduled(
            initialDelayString = "${autopilot.audit.flush-interval:5s}",
            fixedDelayString = "${autopilot.audit.flush-interval:5s}")
    public void scheduledFlush() {
        if (clock.instant().isBefore(nextAttemptAt)) {
            return;
        }
        flush();
    }

    /**
     * Writes buffered records in order until the buffer is empty or a write fails transiently.
     *
     * @return number of records written
     */
    public int flush() {
        synchronized (flushLock) {
            int written = 0;
            while (true) {
                PendingRecord head;
                synchronized (buffer) {
                    head = buffer.peekFirst();
                }
                if (head == null) {
                    break;
                }
                try {
                    adapterCallGuard.run(AdapterName.PERSISTENCE, "write " + head.description(),
                            () -> head.write().accept(persistenceAdapter));
                } catch (AdapterException e) {
                    if (isPermanent(e)) {
                        dropHead(head, e);
                        continue;
                    }
                    consecutiveFailures++;
                    Duration backoff = backoff();
                    nextAttemptAt = clock.instant().plus(backoff);
                    log.warn(
                            "Audit write failed for {} ({} pending, retry in {}): {}",
                            head.description(),
                            pendingCount(),
                            backoff,
                            e.getMessage());
                    break;
                }
                synchronized (buffer) {
                    if (buffer.peekFirst() == head) {
                        buffer.pollFirst();
                    }
                }
                written++;
                consecutiveFailures = 0;
                nextAttemptAt = Instant.EPOCH;
            }
            return written;
        }
    }

    /**
     * Shutdown flush: retries until everything is written or {@code timeout} elapses, ignoring the
     * backoff schedule. Returns true if the buffer was drained.
     */
    public boolean flushWithin(Duration timeout) {
        Instant deadline = clock.instant().plus(timeout);
        while (pendingCount() > 0 && clock.instant().isBefore(deadline)) {
            if (flush() == 0 && pendingCount() > 0) {
                try {
                    Thread.sleep(Math.min(auditSettings.getFlushInterval().toMillis(), 500));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        int remaining = pendingCount();
        if (remaining > 0) {
            log.error("Audit flush incomplete at shutdown: {} record(s) not persisted", remaining);
            return false;
        }
        return true;
    }

    public int pendingCount() {
        synchronized (buffer) {
            return buffer.size();
        }
    }

    public long getDroppedRecords() {
        synchronized (buffer) {
            return droppedRecords;
        }
    }

    /** Data-layer connectivity failures reach here untyped; they are retried like any outage. */
    private static boolean isPermanent(AdapterException e) {
        if (e.isTransientFailure()) {
            return false;
        }
        Throwable cause = e.getCause();
        return !(cause instanceof TransientDataAccessException
                || cause instanceof RecoverableDataAccessException
                || cause instanceof DataAccessResourceFailureException);
    }

    private void dropHead(PendingRecord head, AdapterException e) {
        synchronized (buffer) {
            if (buffer.peekFirst() == head) {
                buffer.pollFirst();
            }
            droppedRecords++;
        }
        log.error("Audit write rejected for {}, record dropped: {}", head.description(), e.getMessage());
    }

    private void enqueue(String description, Consumer<PersistenceAdapter> write) {
        synchronized (buffer) {
            if (buffer.size() >= auditSettings.getBufferCapacity()) {
                PendingRecord dropped = buffer.pollFirst();
                droppedRecords++;
                log.warn("Audit buffer full ({}), dropped oldest record: {}", buffer.size() + 1, dropped.description());
            }
            buffer.addLast(new PendingRecord(description, write));
        }
    }

    private Duration backoff() {
        long factor = 1L << Math.min(consecutiveFailures - 1, 16);
        Duration candidate = auditSettings.getFlushInterval().multipliedBy(factor);
        return candidate.compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : candidate;
    }

    private record PendingRecord(String description, Consumer<PersistenceAdapter> write) {}
}
