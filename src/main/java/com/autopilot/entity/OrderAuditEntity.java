package com.autopilot.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "order_audit", indexes = @Index(name = "idx_order_audit_account", columnList = "account_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderAuditEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long cycleSequence;

    @Column(name = "account_id", length = 50)
    private String accountId;

    @Column(length = 20)
    private String symbol;

    @Column(length = 10)
    private String side;

    private Integer requestedQuantity;

    private Integer admittedQuantity;

    @Column(precision = 19, scale = 6)
    private BigDecimal price;

    @Column(length = 64)
    private String orderId;

    @Column(length = 20)
    private String outcome;

    @Column(length = 20)
    private String exitTrigger;

    @Column(length = 500)
    private String reason;

    private Instant at;
}
