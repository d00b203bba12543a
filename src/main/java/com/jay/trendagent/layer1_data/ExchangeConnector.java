package com.jay.trendagent.layer1_data;

import com.jay.trendagent.model.OHLCVBar;
import com.jay.trendagent.model.VenueLimits;
import com.jay.trendagent.model.enums.OrderSide;
import com.jay.trendagent.model.enums.Side;
import com.jay.trendagent.model.enums.TradingHours;

import java.io.IOException;
import java.util.List;
import java.util.OptionalDouble;

/**
 * A trading venue: market data plus market-order placement.
 * Implementations may throw from any call; the engine catches and skips.
 */
public interface ExchangeConnector {

    String name();

    /** Oldest-first bars; the last one may still be forming. */
    List<OHLCVBar> fetchBars(String symbol, String timeframe, int limit) throws IOException;

    /**
     * Places a market order.
     * @return the venue order id, or null when the order was rejected
     */
    String placeOrder(String symbol, OrderSide side, double quantity, boolean reduceOnly);

    /** Quantity the venue currently holds for this direction; empty when unknown. */
    OptionalDouble liveQuantity(String symbol, Side side);

    double minTradableQuantity(String symbol);

    VenueLimits venueLimits(String symbol);

    OptionalDouble accountEquity();

    TradingHours tradingHours();
}
