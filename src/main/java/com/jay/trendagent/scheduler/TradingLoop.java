package com.jay.trendagent.scheduler;

import com.jay.trendagent.config.AgentConfig;
import com.jay.trendagent.layer1_data.ConnectorRegistry;
import com.jay.trendagent.layer1_data.RegisteredConnector;
import com.jay.trendagent.layer2_analysis.IndicatorSnapshotProvider;
import com.jay.trendagent.layer3_signal.EntryEvaluator;
import com.jay.trendagent.layer4_risk.ExposureController;
import com.jay.trendagent.layer4_risk.PortfolioState;
import com.jay.trendagent.layer5_position.PositionBook;
import com.jay.trendagent.layer5_position.PositionStateMachine;
import com.jay.trendagent.layer7_monitor.AdaptiveRiskController;
import com.jay.trendagent.layer7_monitor.RiskSettingsHolder;
import com.jay.trendagent.ledger.LedgerStore;
import com.jay.trendagent.model.BarSnapshot;
import com.jay.trendagent.model.OHLCVBar;
import com.jay.trendagent.model.Position;
import com.jay.trendagent.model.PositionKey;
import com.jay.trendagent.model.RiskSettings;
import com.jay.trendagent.notification.TelegramService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Trading loop: drives the whole agent, one tick per polling interval.
 *
 * Per tick:
 *   1. Brain refresh when due
 *   2. Fetch bars and build a snapshot per (connector, symbol); connectors outside
 *      their trading hours are skipped
 *   3. Advance every open position that received a fresh bar
 *   4. Recompute the exposure budget
 *   5. Evaluate entries on fresh bars, connector then symbol config order
 *   6. Record equity
 *
 * Runs on the single scheduler thread with a fixed delay, so ticks never overlap.
 * Stops after loop.run_duration_hours or when {@link #stop()} is called.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TradingLoop {

    private final AgentConfig config;
    private final ConnectorRegistry connectorRegistry;
    private final IndicatorSnapshotProvider indicators;
    private final PositionBook book;
    private final PositionStateMachine stateMachine;
    private final ExposureController exposureController;
    private final EntryEvaluator entryEvaluator;
    private final AdaptiveRiskController brain;
    private final RiskSettingsHolder settingsHolder;
    private final PortfolioState portfolio;
    private final LedgerStore ledger;
    private final TelegramService telegramService;
    private final Clock clock;

    private Instant startedAt;
    private volatile boolean stopped;

    @Scheduled(fixedDelayString = "#{@agentConfig.loop().getPollingIntervalSeconds() * 1000}",
               initialDelayString = "#{@agentConfig.loop().getInitialDelaySeconds() * 1000}")
    public void scheduledTick() {
        if (stopped) return;
        try {
            tick();
        } catch (Exception e) {
            log.error("Tick failed: {}", e.getMessage(), e);
        }
    }

    public void tick() {
        Instant now = clock.instant();
        if (startedAt == null) {
            startedAt = now;
            log.info("=== TRADING LOOP START — {} connector(s), equity {} ===",
                connectorRegistry.connectors().size(), String.format("%.2f", portfolio.equity()));
            notify("▶️ TREND AGENT STARTED", String.format("Equity %.2f | %d connector(s)",
                portfolio.equity(), connectorRegistry.connectors().size()));
        }
        if (runDurationElapsed(now)) {
            log.info("Run duration of {}h reached", config.loop().getRunDurationHours());
            stop();
            return;
        }

        try {
            brain.refreshIfDue(now);
        } catch (Exception e) {
            log.warn("Brain refresh failed: {} — keeping current settings", e.getMessage());
        }
        RiskSettings settings = settingsHolder.current();

        Map<String, RegisteredConnector> venues = new HashMap<>();
        Map<PositionKey, BarSnapshot> freshBars = collectSnapshots(now, venues);

        // Manage open positions
        for (Position p : book.openPositions()) {
            BarSnapshot bar = freshBars.get(p.getKey());
            if (bar == null) continue;
            try {
                stateMachine.onBar(p, bar, venues.get(p.getKey().connector()), settings.getParameters(), now);
            } catch (Exception e) {
                log.error("Position update failed for {}: {}", p.getKey(), e.getMessage(), e);
            }
        }

        exposureController.beginTick(settings.getParameters(), book.openPositions());

        // Entries
        for (RegisteredConnector venue : connectorRegistry.connectors()) {
            for (String symbol : venue.settings().getSymbols()) {
                PositionKey key = new PositionKey(venue.name(), symbol);
                BarSnapshot bar = freshBars.get(key);
                if (bar == null) continue;
                try {
                    entryEvaluator.evaluate(venue, symbol, bar, settings, now);
                } catch (Exception e) {
                    log.error("Entry evaluation failed for {}: {}", key, e.getMessage(), e);
                }
            }
        }

        try {
            ledger.recordEquity(now, portfolio.equity());
        } catch (Exception e) {
            log.warn("Equity write failed: {}", e.getMessage());
        }
        log.debug("Tick done: {} open position(s), equity {}", book.size(), String.format("%.2f", portfolio.equity()));
    }

    /**
     * Fetches bars for every tradable symbol. Returns snapshots only for keys whose bar is new;
     * every fetched snapshot still refreshes the open position's last price.
     */
    private Map<PositionKey, BarSnapshot> collectSnapshots(Instant now, Map<String, RegisteredConnector> venues) {
        Map<PositionKey, BarSnapshot> fresh = new HashMap<>();
        for (RegisteredConnector venue : connectorRegistry.connectors()) {
            if (!venue.connector().tradingHours().isOpen(now)) {
                log.debug("{} outside trading hours — skipped", venue.name());
                continue;
            }
            venues.put(venue.name(), venue);
            AgentConfig.Connector cfg = venue.settings();
            for (String symbol : cfg.getSymbols()) {
                PositionKey key = new PositionKey(venue.name(), symbol);
                try {
                    List<OHLCVBar> bars = venue.connector().fetchBars(symbol, cfg.getTimeframe(), cfg.getHistoryBars());
                    if (bars == null || bars.isEmpty()) {
                        log.warn("No bars for {} — skipped", key);
                        continue;
                    }
                    BarSnapshot snapshot = indicators.snapshot(symbol, bars, cfg.getTimeframe());
                    Position open = book.get(key);
                    if (open != null) {
                        open.setLastPrice(snapshot.getClose());
                    }
                    if (book.markBar(key, snapshot.getTimestamp())) {
                        fresh.put(key, snapshot);
                    }
                } catch (Exception e) {
                    log.warn("Snapshot failed for {}: {} — skipped", key, e.getMessage());
                }
            }
        }
        return fresh;
    }

    private boolean runDurationElapsed(Instant now) {
        double hours = config.loop().getRunDurationHours();
        if (hours <= 0) return false;
        return !now.isBefore(startedAt.plus(Duration.ofMinutes(Math.round(hours * 60))));
    }

    /** Stops the loop after the current tick; open positions stay as they are. */
    public void stop() {
        if (stopped) return;
        stopped = true;
        log.info("=== TRADING LOOP STOPPED — {} open position(s), equity {} ===",
            book.size(), String.format("%.2f", portfolio.equity()));
        notify("⏹ TREND AGENT STOPPED", String.format("Equity %.2f | %d open position(s)",
            portfolio.equity(), book.size()));
    }

    public boolean isStopped() {
        return stopped;
    }

    private void notify(String title, String body) {
        try {
            telegramService.sendAlert(title, body);
        } catch (Exception e) {
            log.warn("Telegram notification failed: {}", e.getMessage());
        }
    }
}
