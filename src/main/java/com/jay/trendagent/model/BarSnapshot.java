package com.jay.trendagent.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Indicator view of the latest bar for one symbol: price, volatility estimate
 * and the entry signals computed over the loaded history.
 */
@Value
@Builder
public class BarSnapshot {
    Instant timestamp;
    double open;
    double high;
    double low;
    double close;
    double volume;

    /** Average true range; NaN or non-positive when not enough history. */
    double atr;

    boolean longSignal;
    boolean shortSignal;

    public boolean hasUsableAtr() {
        return !Double.isNaN(atr) && atr > 0;
    }
}
