package com.jay.trendagent.model.enums;

public enum Side {
    LONG,
    SHORT;

    /** Order side that opens a position in this direction. */
    public OrderSide entryOrderSide() {
        return this == LONG ? OrderSide.BUY : OrderSide.SELL;
    }

    /** Order side that reduces a position in this direction. */
    public OrderSide exitOrderSide() {
        return this == LONG ? OrderSide.SELL : OrderSide.BUY;
    }

    /** +1 for long, -1 for short: multiply a price delta by this to get P&amp;L per unit. */
    public int sign() {
        return this == LONG ? 1 : -1;
    }
}
