package com.autopilot.repository.jpa;

import com.autopilot.entity.CircuitBreakerEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CircuitBreakerEventJpaRepository extends JpaRepository<CircuitBreakerEventEntity, Long> {}
