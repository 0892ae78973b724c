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
 * JPA entity for the circuit_breaker_events table: trips, manual resets and emergency stops.
 * {@code accountId} is null for the process-wide emergency stop row.
 */
@Entity
@Table(name = "circuit_breaker_events")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CircuitBreakerEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 50)
    private String accountId;

    @Column(length = 40)
    private String eventType;

    @Column(length = 40)
    private String haltReason;

    @Column(length = 20)
    private String level;

    @Column(length = 500)
    private String message;

    @Column(length = 2000)
    private String details;

    private Instant at;
}
