package com.autopilot.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "backtest_results")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestResultEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 50)
    private String strategy;

    /** Comma-separated symbol list. */
    @Column(length = 500)
    private String symbols;

    @Column(precision = 19, scale = 6)
    private BigDecimal totalReturn;

    @Column(precision = 19, scale = 6)
    private BigDecimal sharpeRatio;

    @Column(precision = 19, scale = 6)
    private BigDecimal maxDrawdown;

    private Integer trades;

    private Instant completedAt;
}
