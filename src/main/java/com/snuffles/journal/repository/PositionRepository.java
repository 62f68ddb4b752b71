package com.snuffles.journal.repository;

import com.snuffles.journal.domain.Position;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PositionRepository extends JpaRepository<Position, String> {
    List<Position> findAllByOrderByTickerAsc();
}
