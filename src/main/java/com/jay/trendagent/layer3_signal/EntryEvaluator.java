package com.jay.trendagent.layer3_signal;

import com.jay.trendagent.layer1_data.ExchangeConnector;
import com.jay.trendagent.layer1_data.RegisteredConnector;
import com.jay.trendagent.layer4_risk.PortfolioState;
import com.jay.trendagent.layer4_risk.RiskSizer;
import com.jay.trendagent.layer5_position.PositionBook;
import com.jay.trendagent.layer6_execution.ExecutionEngine;
import com.jay.trendagent.ledger.LedgerStore;
import com.jay.trendagent.model.BarSnapshot;
import com.jay.trendagent.model.Position;
import com.jay.trendagent.model.PositionKey;
import com.jay.trendagent.model.RiskParameters;
import com.jay.trendagent.model.RiskSettings;
import com.jay.trendagent.model.TradeEvent;
import com.jay.trendagent.model.VenueLimits;
import com.jay.trendagent.model.enums.Side;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Layer 3: turns a fresh-bar signal into a new position.
 *
 * Gates, in order: slot free, re-entry cool-down, signal present, symbol not blocked,
 * usable ATR, entry budget left, sized quantity positive, entry order accepted.
 * An accepted entry is charged against this tick's budget immediately.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntryEvaluator {

    private final RiskSizer riskSizer;
    private final PortfolioState portfolio;
    private final PositionBook book;
    private final ExecutionEngine executionEngine;
    private final LedgerStore ledger;

    /**
     * Evaluates one symbol on a fresh bar. Returns the opened position, or null when nothing was opened.
     */
    public Position evaluate(RegisteredConnector venue, String symbol, BarSnapshot bar,
                             RiskSettings settings, Instant now) {
        PositionKey key = new PositionKey(venue.name(), symbol);
        if (book.isOpen(key)) return null;
        if (book.consumeCooldown(key)) {
            log.debug("{} cooling down after last exit — no entry", key);
            return null;
        }

        Side side = bar.isLongSignal() ? Side.LONG : bar.isShortSignal() ? Side.SHORT : null;
        if (side == null) return null;

        if (settings.getBlockedSymbols().isBlocked(symbol, now)) {
            log.info("{} {} signal ignored — symbol blocked", key, side);
            return null;
        }
        if (!bar.hasUsableAtr()) {
            log.debug("{} signal without usable ATR — skipped", key);
            return null;
        }

        RiskParameters params = settings.getParameters();
        double price = bar.getClose();
        double stopDistance = params.getAtrStopMultiple() * bar.getAtr();
        if (price <= 0 || stopDistance <= 0) {
            log.debug("{} degenerate entry (price={}, stopDistance={}) — skipped", key, price, stopDistance);
            return null;
        }

        double budget = portfolio.remainingBudget();
        if (budget <= 0) {
            log.info("{} {} signal skipped — exposure budget exhausted", key, side);
            return null;
        }

        ExchangeConnector connector = venue.connector();
        VenueLimits limits = venueLimits(connector, symbol);
        double quantity = riskSizer.size(portfolio.equity(), params.getRiskPerTrade(), stopDistance, price,
            params.getMaxNotionalPctHard(), budget, limits);
        if (quantity <= 0) {
            log.info("{} {} signal skipped — sized quantity is zero (budget {})", key, side,
                String.format("%.2f", budget));
            return null;
        }

        String orderId = executionEngine.placeEntryOrder(connector, symbol, side, quantity);
        if (orderId == null) return null;

        int sign = side.sign();
        double stop = price - sign * stopDistance;
        Position position = Position.builder()
            .key(key)
            .side(side)
            .entryOrderId(orderId)
            .entryPrice(price)
            .originalQuantity(quantity)
            .remainingQuantity(quantity)
            .openedAt(now)
            .initialStopPrice(stop)
            .stopPrice(stop)
            .tp1Price(price + sign * params.getTp1RMultiple() * stopDistance)
            .tp2Price(price + sign * params.getTp2RMultiple() * stopDistance)
            .riskDistance(Math.abs(price - stop))
            .lastPrice(price)
            .build();

        book.add(position);
        portfolio.consumeBudget(quantity * price);

        double equity = portfolio.equity();
        try {
            position.setTradeId(ledger.recordTradeOpen(position, equity));
            ledger.recordTradeEvent(TradeEvent.entry(now, key, side, price, quantity, equity), position.getTradeId());
        } catch (Exception e) {
            log.warn("Ledger open write failed for {}: {}", key, e.getMessage());
        }

        log.info("ENTER {} {} qty={} @ {} | SL {} TP1 {} TP2 {} | order {}",
            side, key, quantity, price, position.getStopPrice(), position.getTp1Price(),
            position.getTp2Price(), orderId);
        executionEngine.announceEntry(position);
        return position;
    }

    private VenueLimits venueLimits(ExchangeConnector connector, String symbol) {
        try {
            VenueLimits limits = connector.venueLimits(symbol);
            return limits != null ? limits : VenueLimits.unrestricted();
        } catch (Exception e) {
            log.warn("Venue limits unavailable for {} on {}: {}", symbol, connector.name(), e.getMessage());
            return VenueLimits.unrestricted();
        }
    }
}
