package com.jay.trendagent.repository;

import com.jay.trendagent.entity.TradeEventRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TradeEventRecordRepository extends JpaRepository<TradeEventRecord, Long> {

    List<TradeEventRecord> findByTradeIdOrderByEventTimeAsc(String tradeId);
}
