package com.jay.trendagent.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "live_trades")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LiveTradeRecord {

    @Id
    @Column(name = "trade_id", length = 20)
    private String tradeId;

    private String configId;
    private String connector;
    private String symbol;
    private String side;           // LONG/SHORT

    private double entryPrice;
    private double quantity;
    private double stopPrice;
    private double tp1Price;
    private double tp2Price;
    private double riskUsd;        // R distance × quantity at entry
    private double equityAtEntry;
    private String entryOrderId;
    private Instant openedAt;

    // Outcome (filled when the trade is fully closed)
    private Double exitPrice;
    private Double realizedPnl;
    private String exitType;
    private Double equityAtExit;
    private Instant closedAt;
}
