package com.snuffles.journal.repository;

import com.snuffles.journal.domain.TradeLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface TradeLogRepository extends JpaRepository<TradeLogEntry, Long> {

    List<TradeLogEntry> findAllByOrderByTradeDateAscIdAsc();

    List<TradeLogEntry> findByTradeDateBetweenOrderByTradeDateAscIdAsc(LocalDate from, LocalDate to);

    List<TradeLogEntry> findByTradeDateOrderByIdAsc(LocalDate tradeDate);
}
