package com.autopilot.repository.jpa;

import com.autopilot.entity.BacktestResultEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface BacktestResultJpaRepository extends JpaRepository<BacktestResultEntity, Long> {}
