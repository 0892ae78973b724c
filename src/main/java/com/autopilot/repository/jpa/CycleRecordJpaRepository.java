package com.autopilot.repository.jpa;

import com.autopilot.entity.CycleRecordEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the cycle_records table. Rows are written by the audit buffer in sequence
 * order.
 */
@Repository
public interface CycleRecordJpaRepository extends JpaRepository<CycleRecordEntity, Long> {

    boolean existsBySequence(Long sequence);

    List<CycleRecordEntity> findAllByOrderBySequenceAsc();
}
