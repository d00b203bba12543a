package com.jay.trendagent.ledger;

import com.jay.trendagent.model.BlockedSymbol;
import com.jay.trendagent.model.Position;
import com.jay.trendagent.model.TradeEvent;
import com.jay.trendagent.model.TradeOutcomeSample;
import com.jay.trendagent.model.enums.BrainMode;
import com.jay.trendagent.model.enums.ExitReason;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;

/**
 * Ledger used when persistence is disabled. Trades get no id and the Brain sees no history,
 * so it keeps the static default parameters.
 */
@Slf4j
public class NoOpLedgerStore implements LedgerStore {

    public NoOpLedgerStore() {
        log.info("Ledger disabled — trades and equity are kept in memory only");
    }

    @Override
    public String recordTradeOpen(Position position, double equityAtEntry) {
        return null;
    }

    @Override
    public void recordTradeEvent(TradeEvent event, String tradeId) {
    }

    @Override
    public void recordTradeClose(String tradeId, double exitPrice, double realizedPnl,
                                 ExitReason reason, double equityAtExit, Instant closedAt) {
    }

    @Override
    public List<TradeOutcomeSample> readRecentClosedTrades(int limit) {
        return List.of();
    }

    @Override
    public List<BlockedSymbol> readBlockedSymbols() {
        return List.of();
    }

    @Override
    public void writeBlockedSymbol(String symbol, Instant expiry, String reason) {
    }

    @Override
    public void recordEquity(Instant time, double equity) {
    }

    @Override
    public void recordBrainSnapshot(BrainMode mode, String payloadJson, Instant at) {
    }
}
