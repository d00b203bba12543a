package com.jay.trendagent.model;

import com.jay.trendagent.model.enums.ExitReason;
import com.jay.trendagent.model.enums.Side;

import java.time.Instant;

/**
 * One row of the trade log: an entry or an exit (partial or full).
 */
public record TradeEvent(
    Instant time,
    PositionKey key,
    String type,            // ENTER or an ExitReason name
    Side side,
    double price,
    double quantity,
    Double pnl,             // null for entries
    double equityAfter
) {

    public static final String ENTER = "ENTER";

    public static TradeEvent entry(Instant time, PositionKey key, Side side, double price,
                                   double quantity, double equity) {
        return new TradeEvent(time, key, ENTER, side, price, quantity, null, equity);
    }

    public static TradeEvent exit(Instant time, PositionKey key, ExitReason reason, Side side,
                                  double price, double quantity, double pnl, double equity) {
        return new TradeEvent(time, key, reason.name(), side, price, quantity, pnl, equity);
    }
}
