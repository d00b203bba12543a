package com.jay.trendagent.model.enums;

public enum OrderSide {
    BUY,
    SELL
}
