package com.jay.trendagent.layer6_execution;

import com.jay.trendagent.layer1_data.ExchangeConnector;
import com.jay.trendagent.model.Position;
import com.jay.trendagent.model.enums.ExitReason;
import com.jay.trendagent.model.enums.Side;
import com.jay.trendagent.notification.TelegramService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Layer 6: Execution Engine.
 * Places market orders on a connector and announces the outcome on Telegram.
 *
 * Hard rules enforced here:
 * - Exits are always reduce-only
 * - A rejected order, an exception or a missing id all come back as null; the caller
 *   leaves its state untouched and retries on a later bar
 * - No automatic retry
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionEngine {

    private final TelegramService telegramService;

    /** Opens a position. Returns the venue order id or null. */
    public String placeEntryOrder(ExchangeConnector connector, String symbol, Side side, double quantity) {
        String orderId;
        try {
            orderId = connector.placeOrder(symbol, side.entryOrderSide(), quantity, false);
        } catch (Exception e) {
            log.error("Entry order exception on {} for {}: {}", connector.name(), symbol, e.getMessage());
            orderId = null;
        }
        if (isBlank(orderId)) {
            log.warn("Entry order for {} {} qty={} on {} failed", side, symbol, quantity, connector.name());
            notify(String.format("❌ <b>ENTRY FAILED</b>%n%s %s × %s on %s",
                side, symbol, fmt(quantity), connector.name()));
            return null;
        }
        return orderId;
    }

    /** Reduces {@code position} by {@code quantity}. Returns the venue order id or null. */
    public String placeExitOrder(ExchangeConnector connector, Position position, double quantity, ExitReason reason) {
        String symbol = position.getKey().symbol();
        String orderId;
        try {
            orderId = connector.placeOrder(symbol, position.getSide().exitOrderSide(), quantity, true);
        } catch (Exception e) {
            log.error("{} exit exception for {}: {}", reason, position.getKey(), e.getMessage());
            orderId = null;
        }
        if (isBlank(orderId)) {
            log.warn("{} exit for {} qty={} failed — will retry on the next bar", reason, position.getKey(), quantity);
            notify(String.format("⚠️ <b>%s EXIT FAILED</b>%n%s × %s — retrying next bar",
                reason, position.getKey(), fmt(quantity)));
            return null;
        }
        return orderId;
    }

    public void announceEntry(Position position) {
        notify(String.format("📥 <b>ENTER %s</b>%n%s × %s @ %s%nSL %s | TP1 %s | TP2 %s",
            position.getSide(), position.getKey(), fmt(position.getOriginalQuantity()),
            fmt(position.getEntryPrice()), fmt(position.getStopPrice()),
            fmt(position.getTp1Price()), fmt(position.getTp2Price())));
    }

    public void announceExit(Position position, ExitReason reason, double price, double quantity,
                             double pnl, double equity) {
        notify(String.format("📤 <b>%s</b> %s%n%s × %s @ %s%nP&amp;L %+.2f | equity %.2f",
            reason, position.getSide(), position.getKey(), fmt(quantity), fmt(price), pnl, equity));
    }

    private void notify(String message) {
        try {
            telegramService.sendMessage(message);
        } catch (Exception e) {
            log.warn("Telegram notification failed: {}", e.getMessage());
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String fmt(double v) {
        return String.format("%.6g", v);
    }
}
