package com.jay.trendagent.model;

import java.time.Instant;

/**
 * A symbol barred from new entries. A null {@code blockedUntil} means blocked until cleared.
 */
public record BlockedSymbol(String symbol, Instant blockedUntil, String reason) {

    public boolean isActive(Instant now) {
        return blockedUntil == null || now.isBefore(blockedUntil);
    }
}
