package com.snuffles.journal.repository;

import com.snuffles.journal.domain.CashAccount;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CashAccountRepository extends JpaRepository<CashAccount, Integer> {

    /**
     * Reads the cash row with a {@code SELECT ... FOR UPDATE}. Held until the surrounding
     * transaction ends, so it serializes all ledger writers.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from CashAccount c where c.id = :id")
    Optional<CashAccount> lockById(@Param("id") Integer id);
}
