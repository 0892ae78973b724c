package com.autopilot.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** JPA entity for the daily_reports table. One row per account per trading date. */
@Entity
@Table(
        name = "daily_reports",
        uniqueConstraints = @UniqueConstraint(columnNames = {"account_id", "trading_date"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailyReportEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", length = 50)
    private String accountId;

    @Column(name = "trading_date")
    private LocalDate tradingDate;

    @Column(precision = 19, scale = 4)
    private BigDecimal startEquity;

    @Column(precision = 19, scale = 4)
    private BigDecimal endEquity;

    @Column(precision = 19, scale = 4)
    private BigDecimal dailyPnlPct;

    @Column(precision = 19, scale = 4)
    private BigDecimal exposurePct;

    private Integer trades;

    private Integer errors;

    private Boolean criticalError;

    private Integer openPositions;

    @Column(length = 2)
    private String grade;
}
