package com.jay.trendagent.model;

import com.jay.trendagent.model.enums.Side;

import java.time.Instant;

/**
 * A closed trade as read back from the ledger. Input to the Brain statistics only.
 */
public record TradeOutcomeSample(
    String symbol,
    Side side,
    double entryPrice,
    double exitPrice,
    double quantity,
    double realizedPnl,
    double riskAtEntry,
    double equityAtEntry,
    double equityAtExit,
    String closeReason,
    Instant closedAt
) {

    public boolean isWin() {
        return realizedPnl > 0;
    }

    public boolean hasRisk() {
        return riskAtEntry > 0;
    }

    /** Realized P&amp;L in units of the initial risk. Only meaningful when {@link #hasRisk()}. */
    public double rMultiple() {
        return realizedPnl / riskAtEntry;
    }
}
