package com.jay.trendagent.layer5_position;

import com.jay.trendagent.layer1_data.ExchangeConnector;
import com.jay.trendagent.layer1_data.RegisteredConnector;
import com.jay.trendagent.layer4_risk.PortfolioState;
import com.jay.trendagent.layer4_risk.RiskSizer;
import com.jay.trendagent.layer6_execution.ExecutionEngine;
import com.jay.trendagent.ledger.LedgerStore;
import com.jay.trendagent.model.BarSnapshot;
import com.jay.trendagent.model.Position;
import com.jay.trendagent.model.RiskParameters;
import com.jay.trendagent.model.TradeEvent;
import com.jay.trendagent.model.VenueLimits;
import com.jay.trendagent.model.enums.ExitReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.OptionalDouble;

/**
 * Layer 5: lifecycle of one open position, advanced once per fresh bar.
 *
 * Order of checks on every bar:
 * <ol>
 *   <li>ATR trailing stop (tighten only)</li>
 *   <li>Break-even once the move reaches the trigger in R</li>
 *   <li>TP1: close a fraction of the original quantity</li>
 *   <li>TP2: close a fraction of what is left</li>
 *   <li>Stop crossed: close the remainder at the stop price</li>
 *   <li>Time exit after max bars unless TP2 already filled</li>
 * </ol>
 * A venue remainder below the minimum tradable size is closed internally as dust, without an order.
 * A failed order leaves the position untouched; the same check runs again on the next bar.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionStateMachine {

    private static final double EPS = 1e-12;

    private final ExecutionEngine executionEngine;
    private final LedgerStore ledger;
    private final PortfolioState portfolio;
    private final PositionBook book;

    /**
     * Applies one fresh bar to {@code p}. Returns true while the position stays open.
     */
    public boolean onBar(Position p, BarSnapshot bar, RegisteredConnector venue, RiskParameters params, Instant now) {
        double price = bar.getClose();
        p.setLastPrice(price);

        // 1. Trailing stop
        if (bar.hasUsableAtr() && params.getTrailAtrMultiple() > 0) {
            double candidate = price - p.getSide().sign() * params.getTrailAtrMultiple() * bar.getAtr();
            if (p.tightenStop(candidate)) {
                p.setTrailingActive(true);
                log.debug("{} trailing stop → {}", p.getKey(), p.getStopPrice());
            }
        }

        // 2. Break-even
        if (!p.isMovedToBreakEven()
                && p.favourableMove(price) >= params.getBreakEvenTriggerR() * p.getRiskDistance()) {
            p.tightenStop(p.getEntryPrice());
            p.setMovedToBreakEven(true);
            log.info("{} break-even armed at {} (stop now {})", p.getKey(), price, p.getStopPrice());
        }

        // 3. TP1
        if (!p.isTp1Done() && p.reached(price, p.getTp1Price())) {
            takePartial(p, venue, ExitReason.TP1, p.getOriginalQuantity() * params.getTp1ClosePct(), price, now);
            if (p.isClosed()) return false;
        }

        // 4. TP2
        if (!p.isTp2Done() && p.reached(price, p.getTp2Price())) {
            takePartial(p, venue, ExitReason.TP2, p.getRemainingQuantity() * params.getTp2ClosePct(), price, now);
            if (p.isClosed()) return false;
        }

        // 5. Stop
        boolean stopPending = false;
        if (p.stopCrossed(price)) {
            ExitReason reason = Double.compare(p.getStopPrice(), p.getInitialStopPrice()) == 0
                ? ExitReason.STOP_LOSS
                : ExitReason.TRAILING_STOP;
            closeRemainder(p, venue, reason, p.getStopPrice(), now);
            if (p.isClosed()) return false;
            stopPending = true;
        }

        // 6. Time exit
        p.setBarsElapsed(p.getBarsElapsed() + 1);
        if (!stopPending && p.getBarsElapsed() >= params.getMaxBarsInTrade() && !p.isTp2Done()) {
            closeRemainder(p, venue, ExitReason.TIME_EXIT, price, now);
            if (p.isClosed()) return false;
        }

        // Leftover below what the venue can trade
        double minQty = minTradable(venue.connector(), p);
        if (minQty > 0 && p.getRemainingQuantity() < minQty) {
            log.info("{} remainder {} below venue minimum {} — closing as dust", p.getKey(),
                p.getRemainingQuantity(), minQty);
            dustClose(p, venue, now);
            return false;
        }
        return true;
    }

    // ── Exits ─────────────────────────────────────────────────────────────────

    private void takePartial(Position p, RegisteredConnector venue, ExitReason reason,
                             double rawQuantity, double price, Instant now) {
        ExchangeConnector connector = venue.connector();
        VenueLimits limits = venueLimits(connector, p);
        double requested = RiskSizer.floorToStep(rawQuantity, limits.quantityStep());

        OptionalDouble live = liveQuantity(connector, p);
        if (isDust(live, limits.minQuantity())) {
            log.info("{} {}: venue holds {} (min {}) — closing remainder as dust",
                p.getKey(), reason, live.getAsDouble(), limits.minQuantity());
            dustClose(p, venue, now);
            return;
        }

        double quantity = Math.min(requested, p.getRemainingQuantity());
        if (live.isPresent()) {
            quantity = Math.min(quantity, live.getAsDouble());
        }
        if (quantity <= 0) {
            log.info("{} {} reached but partial size rounds to zero — marking done", p.getKey(), reason);
            markDone(p, reason);
            return;
        }

        if (executionEngine.placeExitOrder(connector, p, quantity, reason) == null) {
            return;
        }

        double pnl = p.pnlFor(price, quantity);
        p.setRemainingQuantity(Math.max(0, p.getRemainingQuantity() - quantity));
        markDone(p, reason);
        realize(p, reason, price, quantity, pnl, now);

        if (p.getRemainingQuantity() <= EPS) {
            finalizeClose(p, venue, price, reason, now);
        }
    }

    private void closeRemainder(Position p, RegisteredConnector venue, ExitReason reason,
                                double exitPrice, Instant now) {
        ExchangeConnector connector = venue.connector();
        OptionalDouble live = liveQuantity(connector, p);
        double minQty = minTradable(connector, p);
        if (isDust(live, minQty)) {
            log.info("{} {}: venue holds {} (min {}) — closing as dust", p.getKey(), reason, live.getAsDouble(), minQty);
            dustClose(p, venue, now);
            return;
        }

        double remaining = p.getRemainingQuantity();
        double orderQty = live.isPresent() ? Math.min(remaining, live.getAsDouble()) : remaining;
        if (executionEngine.placeExitOrder(connector, p, orderQty, reason) == null) {
            return;
        }

        // P&L on the internal remainder; any venue shortfall was already gone
        double pnl = p.pnlFor(exitPrice, remaining);
        p.setRemainingQuantity(0);
        realize(p, reason, exitPrice, remaining, pnl, now);
        finalizeClose(p, venue, exitPrice, reason, now);
    }

    private void dustClose(Position p, RegisteredConnector venue, Instant now) {
        double price = p.getLastPrice();
        double remaining = p.getRemainingQuantity();
        double pnl = p.pnlFor(price, remaining);
        p.setRemainingQuantity(0);
        realize(p, ExitReason.DUST, price, remaining, pnl, now);
        finalizeClose(p, venue, price, ExitReason.DUST, now);
    }

    private void realize(Position p, ExitReason reason, double price, double quantity, double pnl, Instant now) {
        p.setRealizedPnl(p.getRealizedPnl() + pnl);
        double equity = portfolio.applyRealizedPnl(pnl);
        log.info("{} {} {} qty={} @ {} pnl={} equity={}", reason, p.getSide(), p.getKey(),
            quantity, price, String.format("%.2f", pnl), String.format("%.2f", equity));

        TradeEvent event = TradeEvent.exit(now, p.getKey(), reason, p.getSide(), price, quantity, pnl, equity);
        try {
            ledger.recordTradeEvent(event, p.getTradeId());
        } catch (Exception e) {
            log.warn("Ledger event write failed for {} {}: {}", p.getKey(), reason, e.getMessage());
        }
        executionEngine.announceExit(p, reason, price, quantity, pnl, equity);
    }

    private void finalizeClose(Position p, RegisteredConnector venue, double exitPrice, ExitReason reason, Instant now) {
        p.setClosed(true);
        book.remove(p.getKey());
        book.startCooldown(p.getKey(), venue.settings().getReentryCooldownBars());
        log.info("Closed {} by {} — total P&L {}", p.getKey(), reason, String.format("%.2f", p.getRealizedPnl()));
        try {
            ledger.recordTradeClose(p.getTradeId(), exitPrice, p.getRealizedPnl(), reason, portfolio.equity(), now);
        } catch (Exception e) {
            log.warn("Ledger close write failed for {}: {}", p.getKey(), e.getMessage());
        }
    }

    private static void markDone(Position p, ExitReason reason) {
        if (reason == ExitReason.TP1) p.setTp1Done(true);
        else if (reason == ExitReason.TP2) p.setTp2Done(true);
    }

    // ── Venue queries (failures mean "unknown") ──────────────────────────────

    private static boolean isDust(OptionalDouble live, double minQty) {
        return live.isPresent() && (live.getAsDouble() <= EPS || live.getAsDouble() < minQty);
    }

    private OptionalDouble liveQuantity(ExchangeConnector connector, Position p) {
        try {
            OptionalDouble live = connector.liveQuantity(p.getKey().symbol(), p.getSide());
            return live != null ? live : OptionalDouble.empty();
        } catch (Exception e) {
            log.warn("Live quantity unavailable for {}: {}", p.getKey(), e.getMessage());
            return OptionalDouble.empty();
        }
    }

    private double minTradable(ExchangeConnector connector, Position p) {
        try {
            return connector.minTradableQuantity(p.getKey().symbol());
        } catch (Exception e) {
            log.warn("Minimum quantity unavailable for {}: {}", p.getKey(), e.getMessage());
            return 0;
        }
    }

    private VenueLimits venueLimits(ExchangeConnector connector, Position p) {
        try {
            VenueLimits limits = connector.venueLimits(p.getKey().symbol());
            return limits != null ? limits : VenueLimits.unrestricted();
        } catch (Exception e) {
            log.warn("Venue limits unavailable for {}: {}", p.getKey(), e.getMessage());
            return VenueLimits.unrestricted();
        }
    }
}
