package com.jay.trendagent.model;

import lombok.Builder;
import lombok.Value;

/**
 * Risk knobs shared by the sizer, the exposure controller and the position state machine.
 * Immutable: the Brain replaces the whole value, never single fields.
 */
@Value
@Builder(toBuilder = true)
public class RiskParameters {
    double riskPerTrade;            // fraction of equity risked per entry
    double maxPortfolioExposure;    // fraction of equity allowed in open notional
    double maxNotionalPctHard;      // per-position notional cap, fraction of equity
    double atrStopMultiple;         // stop distance in ATR units
    double tp1RMultiple;
    double tp2RMultiple;
    double tp1ClosePct;             // fraction of the original quantity
    double tp2ClosePct;             // fraction of the quantity left after TP1
    double breakEvenTriggerR;
    double trailAtrMultiple;
    int maxBarsInTrade;
}
