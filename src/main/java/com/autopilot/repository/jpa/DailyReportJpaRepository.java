package com.autopilot.repository.jpa;

import com.autopilot.entity.DailyReportEntity;
import java.time.LocalDate;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DailyReportJpaRepository extends JpaRepository<DailyReportEntity, Long> {

    Optional<DailyReportEntity> findByAccountIdAndTradingDate(String accountId, LocalDate tradingDate);
}
