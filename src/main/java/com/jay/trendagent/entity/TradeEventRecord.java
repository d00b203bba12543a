package com.jay.trendagent.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "trade_events")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeEventRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String tradeId;
    private Instant eventTime;
    private String connector;
    private String symbol;
    private String eventType;      // ENTER/TP1/TP2/STOP_LOSS/TRAILING_STOP/TIME_EXIT/DUST
    private String side;
    private double price;
    private double quantity;
    private Double pnl;
    private double equity;
}
