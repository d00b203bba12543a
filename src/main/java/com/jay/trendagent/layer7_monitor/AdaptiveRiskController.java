package com.jay.trendagent.layer7_monitor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jay.trendagent.config.AgentConfig;
import com.jay.trendagent.ledger.LedgerStore;
import com.jay.trendagent.model.BlockedSymbol;
import com.jay.trendagent.model.BlockedSymbolSet;
import com.jay.trendagent.model.RiskParameters;
import com.jay.trendagent.model.RiskSettings;
import com.jay.trendagent.model.TradeOutcomeSample;
import com.jay.trendagent.model.enums.BrainMode;
import com.jay.trendagent.notification.TelegramService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Layer 7: Adaptive Risk Controller ("the Brain").
 * Reads recent closed trades, picks a risk mode, flags persistently underperforming symbols
 * and publishes a new {@link RiskSettings} generation.
 *
 * Mode rules (short window):
 * - equity change ≤ defensive threshold OR avg R ≤ defensive threshold → DEFENSIVE
 * - equity change ≥ aggressive threshold AND avg R ≥ aggressive threshold → AGGRESSIVE
 * - otherwise NORMAL
 *
 * Too little history, or a ledger read failure, keeps the previous settings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdaptiveRiskController {

    static final String BLOCK_NOTE = "auto-blocked: persistent underperformance vs portfolio baseline";

    private final AgentConfig config;
    private final LedgerStore ledger;
    private final RiskSettingsHolder settingsHolder;
    private final TelegramService telegramService;
    private final ObjectMapper mapper = new ObjectMapper();

    private Instant lastRefresh;

    /** Runs {@link #refresh(Instant)} if the Brain is enabled and its interval has elapsed. */
    public boolean refreshIfDue(Instant now) {
        AgentConfig.Brain cfg = config.brain();
        if (!cfg.isEnabled()) return false;
        if (lastRefresh != null && now.isBefore(lastRefresh.plus(Duration.ofMinutes(cfg.getRefreshMinutes())))) {
            return false;
        }
        lastRefresh = now;
        refresh(now);
        return true;
    }

    /**
     * One Brain cycle. Returns the settings in force afterwards (the previous ones if nothing changed).
     */
    public RiskSettings refresh(Instant now) {
        AgentConfig.Brain cfg = config.brain();
        RiskSettings previous = settingsHolder.current();

        List<TradeOutcomeSample> baseline;
        try {
            baseline = ledger.readRecentClosedTrades(cfg.getBaselineWindow());
        } catch (Exception e) {
            log.warn("Brain: closed-trade read failed ({}) — keeping v{} {}", e.getMessage(),
                previous.getVersion(), previous.getMode());
            return previous;
        }
        if (baseline.size() < cfg.getMinTrades()) {
            log.warn("Brain: only {} closed trade(s), need {} — keeping v{} {}", baseline.size(),
                cfg.getMinTrades(), previous.getVersion(), previous.getMode());
            return previous;
        }

        List<TradeOutcomeSample> recent = baseline.subList(0, Math.min(cfg.getShortWindow(), baseline.size()));
        TradeStatistics shortStats = TradeStatistics.of(recent);
        TradeStatistics baseStats = TradeStatistics.of(baseline);

        double winShort = shortStats.winRateOr(0);
        double avgRShort = shortStats.avgROr(0);
        double equityChange = shortStats.equityChangeOr(0);
        double winAll = baseStats.winRateOr(winShort);
        double avgRAll = baseStats.avgROr(avgRShort);

        BrainMode mode = decideMode(equityChange, avgRShort, cfg);
        RiskParameters params = parametersFor(mode);

        BlockedSymbolSet flagged = flagUnderperformers(baseline, winAll, avgRAll, now);
        BlockedSymbolSet blocked = carriedBlocks(previous.getBlockedSymbols(), now).merge(flagged);

        RiskSettings next = previous.next(mode, params, blocked, now);
        settingsHolder.publish(next);
        log.info("Brain: mode {} | win {}/{} avgR {}/{} equity {}% | blocked {}",
            mode, pct(winShort), pct(winAll), fmt(avgRShort), fmt(avgRAll), fmt(equityChange * 100),
            blocked.activeSymbols(now));

        recordSnapshot(next, winShort, avgRShort, equityChange, winAll, avgRAll, baseline.size(), now);
        if (mode != previous.getMode()) {
            announceModeChange(previous.getMode(), next, equityChange, avgRShort);
        }
        return next;
    }

    static BrainMode decideMode(double equityChange, double avgR, AgentConfig.Brain cfg) {
        if (equityChange <= cfg.getDefensiveEquityChange() || avgR <= cfg.getDefensiveAvgR()) {
            return BrainMode.DEFENSIVE;
        }
        if (equityChange >= cfg.getAggressiveEquityChange() && avgR >= cfg.getAggressiveAvgR()) {
            return BrainMode.AGGRESSIVE;
        }
        return BrainMode.NORMAL;
    }

    /** Static risk defaults with the mode-dependent fields taken from the preset. */
    RiskParameters parametersFor(BrainMode mode) {
        AgentConfig.ModePreset preset = config.brain().preset(mode);
        return config.risk().toParameters().toBuilder()
            .riskPerTrade(preset.getRiskPerTrade())
            .maxPortfolioExposure(preset.getMaxPortfolioExposure())
            .trailAtrMultiple(preset.getTrailAtrMultiple())
            .build();
    }

    // ── Symbol filter ────────────────────────────────────────────────────────

    private BlockedSymbolSet flagUnderperformers(List<TradeOutcomeSample> baseline,
                                                 double winAll, double avgRAll, Instant now) {
        AgentConfig.Brain cfg = config.brain();
        Map<String, List<TradeOutcomeSample>> bySymbol = new TreeMap<>();
        for (TradeOutcomeSample t : baseline) {
            if (t.symbol() == null || t.symbol().isBlank()) continue;
            bySymbol.computeIfAbsent(t.symbol(), s -> new ArrayList<>()).add(t);
        }

        Instant until = now.plus(Duration.ofMinutes(Math.round(cfg.getBlockCooldownHours() * 60)));
        double winFloor = Math.max(0.0, winAll - cfg.getSymbolWinRateMargin());
        double avgRFloor = avgRAll - cfg.getSymbolAvgRMargin();

        BlockedSymbolSet flagged = BlockedSymbolSet.empty();
        for (Map.Entry<String, List<TradeOutcomeSample>> e : bySymbol.entrySet()) {
            if (e.getValue().size() < cfg.getSymbolMinTrades()) continue;
            TradeStatistics s = TradeStatistics.of(e.getValue());
            if (s.winRate() == null || s.avgR() == null) continue;

            if (s.winRate() <= winFloor && s.avgR() <= avgRFloor && s.avgR() < 0) {
                String symbol = e.getKey();
                log.info("Brain: blocking {} until {} (win {} avgR {} over {} trades)",
                    symbol, until, pct(s.winRate()), fmt(s.avgR()), s.trades());
                flagged = flagged.with(new BlockedSymbol(symbol, until, BLOCK_NOTE));
                try {
                    ledger.writeBlockedSymbol(symbol, until, BLOCK_NOTE);
                } catch (Exception ex) {
                    log.warn("Brain: block write failed for {}: {}", symbol, ex.getMessage());
                }
            }
        }
        return flagged;
    }

    /**
     * Blocks carried into the next generation. The ledger rows are authoritative, so a row
     * cleared or deleted there lifts the block on the next cycle. Timed auto-blocks from earlier
     * cycles are kept until expiry in case their ledger write failed. If the read fails the
     * previous set is kept as it is.
     */
    private BlockedSymbolSet carriedBlocks(BlockedSymbolSet previous, Instant now) {
        List<BlockedSymbol> rows;
        try {
            rows = ledger.readBlockedSymbols();
        } catch (Exception e) {
            log.warn("Brain: blocked-symbol read failed ({}), keeping previous blocks", e.getMessage());
            return previous.withoutExpired(now);
        }
        List<BlockedSymbol> autoBlocks = previous.entries().stream()
            .filter(b -> b.blockedUntil() != null && b.isActive(now) && BLOCK_NOTE.equals(b.reason()))
            .toList();
        return BlockedSymbolSet.of(rows).withoutExpired(now).merge(BlockedSymbolSet.of(autoBlocks));
    }

    // ── Audit / notification ─────────────────────────────────────────────────

    private void recordSnapshot(RiskSettings s, double winShort, double avgRShort, double equityChange,
                                double winAll, double avgRAll, int samples, Instant now) {
        try {
            ObjectNode root = mapper.createObjectNode();
            root.put("ts", now.toString());
            root.put("config_id", config.brain().getConfigId());
            root.put("version", s.getVersion());
            root.put("mode", s.getMode().name());
            root.put("samples", samples);
            root.put("win_short", winShort);
            root.put("avg_r_short", avgRShort);
            root.put("equity_change_short", equityChange);
            root.put("win_all", winAll);
            root.put("avg_r_all", avgRAll);
            ArrayNode blocked = root.putArray("blocked_symbols");
            s.getBlockedSymbols().activeSymbols(now).forEach(blocked::add);
            root.put("risk_per_trade", s.getParameters().getRiskPerTrade());
            root.put("max_portfolio_exposure", s.getParameters().getMaxPortfolioExposure());
            root.put("trail_atr_multiple", s.getParameters().getTrailAtrMultiple());
            ledger.recordBrainSnapshot(s.getMode(), mapper.writeValueAsString(root), now);
        } catch (Exception e) {
            log.warn("Brain: snapshot write failed: {}", e.getMessage());
        }
    }

    private void announceModeChange(BrainMode from, RiskSettings next, double equityChange, double avgR) {
        try {
            telegramService.sendAlert("🧠 RISK MODE " + from + " → " + next.getMode(), String.format(
                "Equity change %.1f%% | avg R %.2f%nRisk/trade %.2f%% | max exposure %.0f%%",
                equityChange * 100, avgR,
                next.getParameters().getRiskPerTrade() * 100,
                next.getParameters().getMaxPortfolioExposure() * 100));
        } catch (Exception e) {
            log.warn("Mode change notification failed: {}", e.getMessage());
        }
    }

    private static String pct(double v) {
        return String.format("%.0f%%", v * 100);
    }

    private static String fmt(double v) {
        return String.format("%.2f", v);
    }
}
