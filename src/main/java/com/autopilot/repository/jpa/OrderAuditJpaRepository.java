package com.autopilot.repository.jpa;

import com.autopilot.entity.OrderAuditEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface OrderAuditJpaRepository extends JpaRepository<OrderAuditEntity, Long> {}
