package com.jay.trendagent.layer1_data;

import com.jay.trendagent.model.OHLCVBar;
import com.jay.trendagent.model.VenueLimits;
import com.jay.trendagent.model.enums.OrderSide;
import com.jay.trendagent.model.enums.Side;
import com.jay.trendagent.model.enums.TradingHours;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Paper venue: real Bybit market data, simulated market fills.
 * Tracks the quantity held per symbol and direction so that reduce-only
 * orders and live-quantity checks behave like a real account.
 */
@Slf4j
public class PaperExchangeConnector implements ExchangeConnector {

    private static final double EPS = 1e-9;

    private final String name;
    private final BybitMarketDataClient marketData;
    private final TradingHours tradingHours;
    private final double paperBalance;

    private final Map<String, Double> holdings = new ConcurrentHashMap<>();
    private final AtomicLong orderSeq = new AtomicLong();

    public PaperExchangeConnector(String name, BybitMarketDataClient marketData,
                                  TradingHours tradingHours, double paperBalance) {
        this.name = name;
        this.marketData = marketData;
        this.tradingHours = tradingHours;
        this.paperBalance = paperBalance;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<OHLCVBar> fetchBars(String symbol, String timeframe, int limit) throws IOException {
        return marketData.fetchKlines(symbol, timeframe, limit);
    }

    @Override
    public String placeOrder(String symbol, OrderSide side, double quantity, boolean reduceOnly) {
        if (quantity <= 0) {
            log.warn("[PAPER] {} rejected {} {} qty={} — non-positive quantity", name, side, symbol, quantity);
            return null;
        }
        // BUY opens longs and reduces shorts; SELL the opposite
        Side affected = reduceOnly
            ? (side == OrderSide.SELL ? Side.LONG : Side.SHORT)
            : (side == OrderSide.BUY ? Side.LONG : Side.SHORT);
        String key = holdingKey(symbol, affected);
        double held = holdings.getOrDefault(key, 0.0);

        if (reduceOnly) {
            if (quantity > held + EPS) {
                log.warn("[PAPER] {} rejected reduce-only {} {} qty={} — only {} held",
                    name, side, symbol, quantity, held);
                return null;
            }
            double left = held - quantity;
            if (left <= EPS) holdings.remove(key);
            else holdings.put(key, left);
        } else {
            holdings.put(key, held + quantity);
        }

        String orderId = "PAPER-" + name + "-" + orderSeq.incrementAndGet();
        log.info("[PAPER] {} filled {} {} qty={} reduceOnly={} → {}",
            name, side, symbol, quantity, reduceOnly, orderId);
        return orderId;
    }

    @Override
    public OptionalDouble liveQuantity(String symbol, Side side) {
        return OptionalDouble.of(holdings.getOrDefault(holdingKey(symbol, side), 0.0));
    }

    @Override
    public double minTradableQuantity(String symbol) {
        return venueLimits(symbol).minQuantity();
    }

    @Override
    public VenueLimits venueLimits(String symbol) {
        try {
            return marketData.instrumentLimits(symbol);
        } catch (IOException e) {
            log.warn("Venue limits unavailable for {} on {}: {} — treating as unrestricted",
                symbol, name, e.getMessage());
            return VenueLimits.unrestricted();
        }
    }

    @Override
    public OptionalDouble accountEquity() {
        return OptionalDouble.of(paperBalance);
    }

    @Override
    public TradingHours tradingHours() {
        return tradingHours;
    }

    private static String holdingKey(String symbol, Side side) {
        return symbol + "/" + side;
    }
}
