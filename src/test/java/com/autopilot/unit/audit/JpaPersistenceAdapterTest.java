package com.autopilot.unit.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.autopilot.audit.JpaPersistenceAdapter;
import com.autopilot.domain.enums.OperatingMode;
import com.autopilot.domain.model.CycleResult;
import com.autopilot.domain.model.DailyReport;
import com.autopilot.entity.CycleRecordEntity;
import com.autopilot.entity.DailyReportEntity;
import com.autopilot.mapper.AuditEntityMapper;
import com.autopilot.repository.jpa.BacktestResultJpaRepository;
import com.autopilot.repository.jpa.CircuitBreakerEventJpaRepository;
import com.autopilot.repository.jpa.CycleRecordJpaRepository;
import com.autopilot.repository.jpa.DailyReportJpaRepository;
import com.autopilot.repository.jpa.OrderAuditJpaRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class JpaPersistenceAdapterTest {

    private static final LocalDate TRADING_DATE = LocalDate.of(2026, 3, 11);

    @Mock
    private CycleRecordJpaRepository cycleRecordJpaRepository;

    @Mock
    private OrderAuditJpaRepository orderAuditJpaRepository;

    @Mock
    private CircuitBreakerEventJpaRepository circuitBreakerEventJpaRepository;

    @Mock
    private BacktestResultJpaRepository backtestResultJpaRepository;

    @Mock
    private DailyReportJpaRepository dailyReportJpaRepository;

    @Mock
    private AuditEntityMapper auditEntityMapper;

    private JpaPersistenceAdapter jpaPersistenceAdapter;

    @BeforeEach
    void setUp() {
        jpaPersistenceAdapter = new JpaPersistenceAdapter(
                cycleRecordJpaRepository,
                orderAuditJpaRepository,
                circuitBreakerEventJpaRepository,
                backtestResultJpaRepository,
                dailyReportJpaRepository,
                auditEntityMapper);
    }

    private static CycleResult cycle(long sequence) {
        Instant at = Instant.parse("2026-03-11T15:00:00Z");
        return CycleResult.builder()
                .sequence(sequence)
                .mode(OperatingMode.TRADING)
                .startedAt(at)
                .finishedAt(at)
                .build();
    }

    private static DailyReport report() {
        return DailyReport.builder()
                .accountId("alpha")
                .tradingDate(TRADING_DATE)
                .startEquity(new BigDecimal("30000"))
                .endEquity(new BigDecimal("30450"))
                .dailyPnlPct(new BigDecimal("1.50"))
                .trades(2)
                .grade("B")
                .build();
    }

    @Test
    @DisplayName("Cycle rows are written once per sequence number")
    void recordCycle_skipsExistingSequence() {
        CycleRecordEntity entity = new CycleRecordEntity();
        when(cycleRecordJpaRepository.existsBySequence(7L)).thenReturn(false);
        when(cycleRecordJpaRepository.existsBySequence(8L)).thenReturn(true);
        when(auditEntityMapper.toEntity(any(CycleResult.class))).thenReturn(entity);

        jpaPersistenceAdapter.recordCycle(cycle(7));
        jpaPersistenceAdapter.recordCycle(cycle(8));

        verify(cycleRecordJpaRepository).save(entity);
        verify(auditEntityMapper, never()).toEntity(cycle(8));
    }

    @Test
    @DisplayName("A re-sent daily report overwrites the row for the same account and date")
    void recordDailyReport_updatesExistingRow() {
        DailyReportEntity existing = new DailyReportEntity();
        existing.setId(42L);
        when(auditEntityMapper.toEntity(any(DailyReport.class))).thenReturn(new DailyReportEntity());
        when(dailyReportJpaRepository.findByAccountIdAndTradingDate("alpha", TRADING_DATE))
                .thenReturn(Optional.of(existing));

        jpaPersistenceAdapter.recordDailyReport(report());

        ArgumentCaptor<DailyReportEntity> saved = ArgumentCaptor.forClass(DailyReportEntity.class);
        verify(dailyReportJpaRepository).save(saved.capture());
        assertThat(saved.getValue().getId()).isEqualTo(42L);
    }

    @Test
    @DisplayName("A first daily report is inserted as a new row")
    void recordDailyReport_insertsNewRow() {
        when(auditEntityMapper.toEntity(any(DailyReport.class))).thenReturn(new DailyReportEntity());
        when(dailyReportJpaRepository.findByAccountIdAndTradingDate("alpha", TRADING_DATE))
                .thenReturn(Optional.empty());

        jpaPersistenceAdapter.recordDailyReport(report());

        ArgumentCaptor<DailyReportEntity> saved = ArgumentCaptor.forClass(DailyReportEntity.class);
        verify(dailyReportJpaRepository).save(saved.capture());
        assertThat(saved.getValue().getId()).isNull();
    }

    @Test
    void ping_touchesCycleTable() {
        jpaPersistenceAdapter.ping();

        verify(cycleRecordJpaRepository).count();
    }
}
