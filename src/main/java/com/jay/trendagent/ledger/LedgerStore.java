package com.jay.trendagent.ledger;

import com.jay.trendagent.model.BlockedSymbol;
import com.jay.trendagent.model.Position;
import com.jay.trendagent.model.TradeEvent;
import com.jay.trendagent.model.TradeOutcomeSample;
import com.jay.trendagent.model.enums.BrainMode;
import com.jay.trendagent.model.enums.ExitReason;

import java.time.Instant;
import java.util.List;

/**
 * Trade and equity bookkeeping. Every call is best-effort: implementations may throw,
 * and callers log the failure and carry on with their in-memory state.
 */
public interface LedgerStore {

    /** Records a newly opened trade and returns its ledger id. */
    String recordTradeOpen(Position position, double equityAtEntry);

    /** Appends one entry/exit row to the trade log. {@code tradeId} may be null. */
    void recordTradeEvent(TradeEvent event, String tradeId);

    /** Finalizes a trade: exit price, total realized P&amp;L, reason and equity after the close. */
    void recordTradeClose(String tradeId, double exitPrice, double realizedPnl,
                          ExitReason reason, double equityAtExit, Instant closedAt);

    /** Most recent closed trades, newest first, at most {@code limit}. */
    List<TradeOutcomeSample> readRecentClosedTrades(int limit);

    /** Blocks as stored, including expired ones; the caller filters by time. */
    List<BlockedSymbol> readBlockedSymbols();

    void writeBlockedSymbol(String symbol, Instant expiry, String reason);

    void recordEquity(Instant time, double equity);

    void recordBrainSnapshot(BrainMode mode, String payloadJson, Instant at);
}
