package com.autopilot.observability;

import com.autopilot.domain.model.CycleResult;
import com.autopilot.event.CycleCompletedEvent;
import com.autopilot.event.RiskEvent;
import com.autopilot.event.RiskEventType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the control core.
 *
 * <ul>
 *   <li><b>autopilot.cycles.completed</b> (counter, tag mode)</li>
 *   <li><b>autopilot.cycle.duration</b> (timer)</li>
 *   <li><b>autopilot.orders.submitted</b> / <b>autopilot.orders.rejected</b> (counters)</li>
 *   <li><b>autopilot.circuit-breaker.trips</b> (counter, tag reason)</li>
 *   <li><b>autopilot.accounts.halted</b> and <b>autopilot.cycle.sequence</b> (gauges over the
 *       published snapshot)</li>
 * </ul>
 */
@Service
public class CustomMetricsService {

    private final MeterRegistry meterRegistry;
    private final Timer cycleDurationTimer;
    private final Counter ordersSubmittedCounter;
    private final Counter ordersRejectedCounter;

    public CustomMetricsService(MeterRegistry meterRegistry, SnapshotPublisher snapshotPublisher) {
        this.meterRegistry = meterRegistry;
        this.cycleDurationTimer = Timer.builder("autopilot.cycle.duration")
                .description("Wall-clock duration of scheduler cycles")
                .register(meterRegistry);
        this.ordersSubmittedCounter = Counter.builder("autopilot.orders.submitted")
                .description("Orders admitted by the risk engine and sent to the broker")
                .register(meterRegistry);
        this.ordersRejectedCounter = Counter.builder("autopilot.orders.rejected")
                .description("Candidate actions rejected by the risk engine")
                .register(meterRegistry);

        Gauge.builder("autopilot.accounts.halted", snapshotPublisher, p -> p.current().haltedAccountCount())
                .description("Accounts whose circuit breaker is OPEN")
                .register(meterRegistry);
        Gauge.builder("autopilot.cycle.sequence", snapshotPublisher, p -> p.current().getCycleSequence())
                .description("Sequence number of the last completed cycle")
                .register(meterRegistry);
    }

    @EventListener
    @Order(20)
    public void onCycleCompleted(CycleCompletedEvent event) {
        CycleResult result = event.getResult();
        Counter.builder("autopilot.cycles.completed")
                .tag("mode", result.getMode().name())
                .register(meterRegistry)
                .increment();
        cycleDurationTimer.record(result.getDuration());
        ordersSubmittedCounter.increment(result.getOrdersAttempted());
        ordersRejectedCounter.increment(result.getOrdersRejected());
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        if (event.getEventType() == RiskEventType.CIRCUIT_BREAKER_TRIPPED) {
            Counter.builder("autopilot.circuit-breaker.trips")
                    .tag("reason", String.valueOf(event.getHaltReason()))
                    .register(meterRegistry)
                    .increment();
        }
    }
}
