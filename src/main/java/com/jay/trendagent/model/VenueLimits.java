package com.jay.trendagent.model;

/**
 * Order-size constraints a venue imposes on one instrument.
 * A zero value means the venue did not report that limit.
 */
public record VenueLimits(double minQuantity, double minNotional, double quantityStep) {

    public static final double DEFAULT_STEP = 1e-6;

    public static VenueLimits unrestricted() {
        return new VenueLimits(0, 0, DEFAULT_STEP);
    }
}
