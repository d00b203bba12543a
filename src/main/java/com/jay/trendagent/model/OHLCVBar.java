package com.jay.trendagent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OHLCVBar {
    private Instant timestamp;    // bar open time as reported by the venue
    private double open;
    private double high;
    private double low;
    private double close;
    private double volume;
}
