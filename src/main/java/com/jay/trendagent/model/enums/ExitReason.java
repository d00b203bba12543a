package com.jay.trendagent.model.enums;

public enum ExitReason {
    TP1,
    TP2,
    STOP_LOSS,      // initial stop hit
    TRAILING_STOP,  // stop hit after trailing or break-even moved it
    TIME_EXIT,
    DUST;           // venue remainder below minimum size, closed without an order

    public boolean isPartial() {
        return this == TP1 || this == TP2;
    }
}
