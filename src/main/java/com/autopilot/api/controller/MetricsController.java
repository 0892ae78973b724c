package com.autopilot.api.controller;

import com.autopilot.api.dto.response.CycleSummaryResponse;
import com.autopilot.api.dto.response.MetricsResponse;
import com.autopilot.domain.model.CycleResult;
import com.autopilot.observability.SnapshotPublisher;
import com.autopilot.observability.SystemSnapshot;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /metrics: per-account equity, P&L, exposure and rolling performance, plus the most recent
 * cycles. Reads the last published snapshot only.
 */
@RestController
@RequestMapping("/metrics")
public class MetricsController {

    private final SnapshotPublisher snapshotPublisher;

    public MetricsController(SnapshotPublisher snapshotPublisher) {
        this.snapshotPublisher = snapshotPublisher;
    }

    @GetMapping
    public ResponseEntity<MetricsResponse> getMetrics(
            @RequestParam(name = "recentCycles", defaultValue = "20") int recentCycles) {
        SystemSnapshot snapshot = snapshotPublisher.current();
        List<CycleResult> cycles = snapshot.getRecentCycles();
        int from = Math.max(0, cycles.size() - Math.max(0, recentCycles));

        return ResponseEntity.ok(MetricsResponse.builder()
                .cycleSequence(snapshot.getCycleSequence())
                .mode(snapshot.getMode().name())
                .capturedAt(snapshot.getCapturedAt())
                .lastCycleAt(snapshot.getLastCycleAt())
                .haltedAccounts(snapshot.haltedAccountCount())
                .accounts(snapshot.getAccounts())
                .recentCycles(cycles.subList(from, cycles.size()).stream()
                        .map(MetricsController::toSummary)
                        .toList())
                .build());
    }

    private static CycleSummaryResponse toSummary(CycleResult cycle) {
        return CycleSummaryResponse.builder()
                .sequence(cycle.getSequence())
                .mode(cycle.getMode().name())
                .startedAt(cycle.getStartedAt())
                .durationMs(cycle.getDuration().toMillis())
                .accountsProcessed(cycle.getAccountsProcessed())
                .ordersAttempted(cycle.getOrdersAttempted())
                .ordersFilled(cycle.getOrdersFilled())
                .ordersRejected(cycle.getOrdersRejected())
                .errorCount(cycle.getErrorCount())
                .cancelled(cycle.isCancelled())
                .bestBacktestStrategy(cycle.getBestBacktest() != null ? cycle.getBestBacktest().getStrategy() : null)
                .bestBacktestReturn(cycle.getBestBacktest() != null ? cycle.getBestBacktest().getTotalReturn() : null)
                .build();
    }
}
