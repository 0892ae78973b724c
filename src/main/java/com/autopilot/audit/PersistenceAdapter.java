package com.autopilot.audit;

import com.autopilot.domain.model.BacktestResult;
import com.autopilot.domain.model.CircuitBreakerRecord;
import com.autopilot.domain.model.CycleResult;
import com.autopilot.domain.model.DailyReport;
import com.autopilot.domain.model.OrderAudit;

/**
 * Audit sink. The core never calls it on the order path: records go through
 * {@link BufferedAuditWriter}, which retries and buffers failures.
 */
public interface PersistenceAdapter {

    void recordCycle(CycleResult cycleResult);

    void recordOrder(OrderAudit order);

    void recordCircuitBreakerEvent(CircuitBreakerRecord record);

    void recordBacktest(BacktestResult result);

    void recordDailyReport(DailyReport report);

    /** Connectivity check used by the background health probe. */
    void ping();
}
