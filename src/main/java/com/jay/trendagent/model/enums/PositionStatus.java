package com.jay.trendagent.model.enums;

public enum PositionStatus {
    OPEN,           // entered, no partial exit yet
    PARTIAL_TP1,    // first target filled, remainder running
    PARTIAL_TP2,    // second target filled, remainder trails out
    CLOSED
}
