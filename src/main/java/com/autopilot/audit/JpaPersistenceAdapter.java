package com.autopilot.audit;

import com.autopilot.domain.model.BacktestResult;
import com.autopilot.domain.model.CircuitBreakerRecord;
import com.autopilot.domain.model.CycleResult;
import com.autopilot.domain.model.DailyReport;
import com.autopilot.domain.model.OrderAudit;
import com.autopilot.entity.DailyReportEntity;
import com.autopilot.mapper.AuditEntityMapper;
import com.autopilot.repository.jpa.BacktestResultJpaRepository;
import com.autopilot.repository.jpa.CircuitBreakerEventJpaRepository;
import com.autopilot.repository.jpa.CycleRecordJpaRepository;
import com.autopilot.repository.jpa.DailyReportJpaRepository;
import com.autopilot.repository.jpa.OrderAuditJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Default {@link PersistenceAdapter}: Spring Data JPA on the embedded H2 database.
 *
 * <p>Cycle rows are idempotent on sequence number and daily reports on (account, date), so a
 * record retried after an ambiguous failure is not duplicated.
 */
@Component
public class JpaPersistenceAdapter implements PersistenceAdapter {

    private static final Logger log = LoggerFactory.getLogger(JpaPersistenceAdapter.class);

    private final CycleRecordJpaRepository cycleRecordJpaRepository;
    private final OrderAuditJpaRepository orderAuditJpaRepository;
    private final CircuitBreakerEventJpaRepository circuitBreakerEventJpaRepository;
    private final BacktestResultJpaRepository backtestResultJpaRepository;
    private final DailyReportJpaRepository dailyReportJpaRepository;
    private final AuditEntityMapper auditEntityMapper;

    public JpaPersistenceAdapter(
            CycleRecordJpaRepository cycleRecordJpaRepository,
            OrderAuditJpaRepository orderAuditJpaRepository,
            CircuitBreakerEventJpaRepository circuitBreakerEventJpaRepository,
            BacktestResultJpaRepository backtestResultJpaRepository,
            DailyReportJpaRepository dailyReportJpaRepository,
            AuditEntityMapper auditEntityMapper) {
        this.cycleRecordJpaRepository = cycleRecordJpaRepository;
        this.orderAuditJpaRepository = orderAuditJpaRepository;
        this.circuitBreakerEventJpaRepository = circuitBreakerEventJpaRepository;
        this.backtestResultJpaRepository = backtestResultJpaRepository;
        this.dailyReportJpaRepository = dailyReportJpaRepository;
        this.auditEntityMapper = auditEntityMapper;
    }

    @Override
    @Transactional
    public void recordCycle(CycleResult cycleResult) {
        if (cycleRecordJpaRepository.existsBySequence(cycleResult.getSequence())) {
            log.debug("Cycle {} already recorded", cycleResult.getSequence());
            return;
        }
        cycleRecordJpaRepository.save(auditEntityMapper.toEntity(cycleResult));
    }

    @Override
    public void recordOrder(OrderAudit order) {
        orderAuditJpaRepository.save(auditEntityMapper.toEntity(order));
    }

    @Override
    public void recordCircuitBreakerEvent(CircuitBreakerRecord record) {
        circuitBreakerEventJpaRepository.save(auditEntityMapper.toEntity(record));
    }

    @Override
    public void recordBacktest(BacktestResult result) {
        backtestResultJpaRepository.save(auditEntityMapper.toEntity(result));
    }

    @Override
    @Transactional
    public void recordDailyReport(DailyReport report) {
        DailyReportEntity entity = auditEntityMapper.toEntity(report);
        dailyReportJpaRepository
                .findByAccountIdAndTradingDate(report.getAccountId(), report.getTradingDate())
                .ifPresent(existing -> entity.setId(existing.getId()));
        dailyReportJpaRepository.save(entity);
    }

    @Override
    public void ping() {
        cycleRecordJpaRepository.count();
    }
}
