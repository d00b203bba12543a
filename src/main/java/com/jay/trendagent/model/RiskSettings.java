package com.jay.trendagent.model;

import com.jay.trendagent.model.enums.BrainMode;
import lombok.Value;

import java.time.Instant;

/**
 * One published generation of Brain output. Readers take the whole snapshot at tick start.
 */
@Value
public class RiskSettings {
    long version;
    BrainMode mode;
    RiskParameters parameters;
    BlockedSymbolSet blockedSymbols;
    Instant refreshedAt;

    public RiskSettings next(BrainMode mode, RiskParameters parameters, BlockedSymbolSet blocked, Instant at) {
        return new RiskSettings(version + 1, mode, parameters, blocked, at);
    }
}
