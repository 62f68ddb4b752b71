package com.snuffles.journal.repository;

import com.snuffles.journal.domain.PortfolioHistoryRow;
import com.snuffles.journal.domain.PortfolioHistoryRowId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface PortfolioHistoryRepository extends JpaRepository<PortfolioHistoryRow, PortfolioHistoryRowId> {

    List<PortfolioHistoryRow> findBySnapshotDateOrderByTickerAsc(LocalDate snapshotDate);

    List<PortfolioHistoryRow> findBySnapshotDateBetweenOrderBySnapshotDateAscTickerAsc(LocalDate from, LocalDate to);

    List<PortfolioHistoryRow> findByTickerOrderBySnapshotDateAsc(String ticker);

    List<PortfolioHistoryRow> findAllByOrderBySnapshotDateAscTickerAsc();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from PortfolioHistoryRow r where r.snapshotDate = :date")
    int deleteBySnapshotDate(@Param("date") LocalDate date);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from PortfolioHistoryRow r where r.snapshotDate <> :keep")
    int deleteAllExceptDate(@Param("keep") LocalDate keep);

    @Query("select count(distinct r.snapshotDate) from PortfolioHistoryRow r "
        + "where r.snapshotDate <> :today and r.ticker <> 'TOTAL'")
    long countHistoricalDates(@Param("today") LocalDate today);
}
