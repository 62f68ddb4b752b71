package com.snuffles.journal.repository;

import com.snuffles.journal.domain.CashAdjustment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CashAdjustmentRepository extends JpaRepository<CashAdjustment, Long> {
    List<CashAdjustment> findAllByOrderByAdjustmentDateAscIdAsc();
}
