package com.jay.trendagent.model.enums;

public enum BrainMode {
    DEFENSIVE,      // recent drawdown or negative expectancy: smaller risk, tighter trail
    NORMAL,
    AGGRESSIVE      // strong recent equity growth with good expectancy
}
