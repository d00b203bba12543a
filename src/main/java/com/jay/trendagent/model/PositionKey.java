package com.jay.trendagent.model;

/**
 * Identifies one position slot: a symbol on a named connector.
 */
public record PositionKey(String connector, String symbol) implements Comparable<PositionKey> {

    @Override
    public int compareTo(PositionKey other) {
        int c = connector.compareTo(other.connector);
        return c != 0 ? c : symbol.compareTo(other.symbol);
    }

    @Override
    public String toString() {
        return connector + ":" + symbol;
    }
}
