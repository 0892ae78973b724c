package com.autopilot.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the cycle_records table. One row per recorded cycle, written in sequence order.
 */
@Entity
@Table(name = "cycle_records")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CycleRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private Long sequence;

    @Column(length = 20)
    private String mode;

    private Instant startedAt;

    private Instant finishedAt;

    private Long durationMs;

    private Integer accountsProcessed;

    private Integer ordersAttempted;

    private Integer ordersFilled;

    private Integer ordersRejected;

    private Integer errorCount;

    private Boolean cancelled;

    /** Error messages joined with newlines. */
    @Column(length = 4000)
    private String errors;
}
