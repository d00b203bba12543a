package com.jay.trendagent.repository;

import com.jay.trendagent.entity.LiveTradeRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LiveTradeRecordRepository extends JpaRepository<LiveTradeRecord, String> {

    @Query("SELECT t FROM LiveTradeRecord t WHERE t.configId = :configId " +
           "AND t.closedAt IS NOT NULL AND t.realizedPnl IS NOT NULL ORDER BY t.closedAt DESC")
    List<LiveTradeRecord> findRecentClosed(@Param("configId") String configId, Pageable page);
}
