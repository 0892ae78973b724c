package com.autopilot.observability;

import com.autopilot.audit.BufferedAuditWriter;
import com.autopilot.domain.enums.AlertSeverity;
import com.autopilot.domain.model.Account;
import com.autopilot.domain.model.AccountCycleOutcome;
import com.autopilot.domain.model.CycleResult;
import com.autopilot.domain.model.DailyReport;
import com.autopilot.event.CycleCompletedEvent;
import com.autopilot.notification.NotificationService;
import com.autopilot.risk.RiskState;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * End-of-session report per account, produced when the scheduler leaves TRADING mode.
 *
 * <p>Grades, first match wins (P&L in percent of session-start equity):
 * <pre>
 * F  critical error (breaker tripped today) or errors >= 5
 * A  pnl > 2   and trades >= 3 and errors == 0
 * B  pnl > 1   and trades >= 2 and errors <= 1
 * C  pnl > 0   and trades >= 1 and errors <= 2
 * D  pnl > -2  and errors <= 3
 * F  otherwise
 * </pre>
 */
@Service
public class DailyReportService {

    private static final Logger log = LoggerFactory.getLogger(DailyReportService.class);

    static final int MAX_ERRORS_BEFORE_FAIL = 5;

    private final BufferedAuditWriter bufferedAuditWriter;
    private final NotificationService notificationService;

    /** Account errors since the last report; only touched from the scheduling loop. */
    private final Map<String, Integer> errorsSinceReport = new HashMap<>();

    public DailyReportService(BufferedAuditWriter bufferedAuditWriter, NotificationService notificationService) {
        this.bufferedAuditWriter = bufferedAuditWriter;
        this.notificationService = notificationService;
    }

    @EventListener
    public void onCycleCompleted(CycleCompletedEvent event) {
        CycleResult result = event.getResult();
        for (AccountCycleOutcome outcome : result.getAccountOutcomes()) {
            errorsSinceReport.merge(outcome.getAccountId(), outcome.getErrors().size(), Integer::sum);
        }
    }

    public List<DailyReport> generate(Collection<Account> accounts, LocalDate tradingDate) {
        List<DailyReport> reports = new ArrayList<>();
        for (Account account : accounts) {
            DailyReport report = build(account, tradingDate, errorsSinceReport.getOrDefault(account.getAccountId(), 0));
            reports.add(report);
            bufferedAuditWriter.recordDailyReport(report);
            log.info(
                    "Daily report {} {}: pnl={}%, trades={}, errors={}, grade={}",
                    report.getAccountId(),
                    tradingDate,
                    report.getDailyPnlPct(),
                    report.getTrades(),
                    report.getErrors(),
                    report.getGrade());
            notificationService.notify(
                    AlertSeverity.INFO,
                    "daily-report:" + report.getAccountId() + ":" + tradingDate,
                    String.format(
                            "Daily report %s %s: equity %s, P&L %s%%, exposure %s%%, trades %d, errors %d, grade %s",
                            report.getAccountId(),
                            tradingDate,
                            report.getEndEquity(),
                            report.getDailyPnlPct(),
                            report.getExposurePct(),
                            report.getTrades(),
                            report.getErrors(),
                            report.getGrade()));
        }
        errorsSinceReport.clear();
        return reports;
    }

    DailyReport build(Account account, LocalDate tradingDate, int errors) {
        RiskState risk = account.getRiskState();
        BigDecimal start = account.getSessionStartEquity();
        BigDecimal pnlPct = start.signum() > 0
                ? account.dailyPnl().divide(start, 6, RoundingMode.HALF_UP).movePointRight(2)
                : BigDecimal.ZERO;
        boolean critical = risk.isHalted();
        return DailyReport.builder()
                .accountId(account.getAccountId())
                .tradingDate(tradingDate)
                .startEquity(start)
                .endEquity(account.getEquity())
                .dailyPnlPct(pnlPct.setScale(2, RoundingMode.HALF_UP))
                .exposurePct(account.exposureFraction().movePointRight(2).setScale(2, RoundingMode.HALF_UP))
                .trades(risk.getTradesToday())
                .errors(errors)
                .criticalError(critical)
                .openPositions(account.getPositions().size())
                .grade(grade(pnlPct.doubleValue(), risk.getTradesToday(), errors, critical))
                .build();
    }

    public static String grade(double pnlPct, int trades, int errors, boolean criticalError) {
        if (criticalError || errors >= MAX_ERRORS_BEFORE_FAIL) {
            return "F";
        }
        if (pnlPct > 2.0 && trades >= 3 && errors == 0) {
            return "A";
        }
        if (pnlPct > 1.0 && trades >= 2 && errors <= 1) {
            return "B";
        }
        if (pnlPct > 0 && trades >= 1 && errors <= 2) {
            return "C";
        }
        if (pnlPct > -2.0 && errors <= 3) {
            return "D";
        }
        return "F";
    }
}
