package com.jay.trendagent.model;

import com.jay.trendagent.model.enums.PositionStatus;
import com.jay.trendagent.model.enums.Side;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * One open position per {@link PositionKey}. Mutated only by the tick thread.
 */
@Data
@Builder
public class Position {
    private PositionKey key;
    private Side side;
    private String tradeId;          // ledger id, null when the ledger write failed
    private String entryOrderId;

    // Entry details
    private double entryPrice;
    private double originalQuantity;
    private double remainingQuantity;
    private Instant openedAt;

    // Risk levels
    private double initialStopPrice;
    private double stopPrice;        // only ever tightens
    private double tp1Price;
    private double tp2Price;
    private double riskDistance;     // R = |entry - initial stop|

    // Progress
    private int barsElapsed;
    private boolean tp1Done;
    private boolean tp2Done;
    private boolean movedToBreakEven;
    private boolean trailingActive;

    private double realizedPnl;
    private double lastPrice;
    private boolean closed;

    public PositionStatus status() {
        if (closed) return PositionStatus.CLOSED;
        if (tp2Done) return PositionStatus.PARTIAL_TP2;
        if (tp1Done) return PositionStatus.PARTIAL_TP1;
        return PositionStatus.OPEN;
    }

    /** Currency amount put at risk at entry. */
    public double riskAtEntry() {
        return riskDistance * originalQuantity;
    }

    public double notional(double price) {
        return remainingQuantity * price;
    }

    /** P&amp;L of {@code quantity} units exiting at {@code exitPrice}. */
    public double pnlFor(double exitPrice, double quantity) {
        return (exitPrice - entryPrice) * side.sign() * quantity;
    }

    /** Favourable excursion from entry at {@code price}; negative when underwater. */
    public double favourableMove(double price) {
        return (price - entryPrice) * side.sign();
    }

    public boolean reached(double price, double level) {
        return side.sign() > 0 ? price >= level : price <= level;
    }

    public boolean stopCrossed(double price) {
        return side.sign() > 0 ? price <= stopPrice : price >= stopPrice;
    }

    /**
     * Moves the stop to {@code candidate} if that reduces risk. Returns true if the stop moved.
     */
    public boolean tightenStop(double candidate) {
        boolean tighter = side.sign() > 0 ? candidate > stopPrice : candidate < stopPrice;
        if (tighter) {
            stopPrice = candidate;
        }
        return tighter;
    }
}
