package com.jay.trendagent.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.jay.trendagent.model.RiskParameters;
import com.jay.trendagent.model.enums.BrainMode;
import com.jay.trendagent.model.enums.TradingHours;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.PropertyPlaceholderHelper;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads and exposes all configuration from config.yaml.
 * Values are read once at startup and cached. Edit config.yaml and restart to apply changes.
 */
@Slf4j
@Component
public class AgentConfig {

    @Value("${agent.config-file:config.yaml}")
    private String configFile;

    @Autowired
    private Environment env;

    private static final PropertyPlaceholderHelper PLACEHOLDER_HELPER =
        new PropertyPlaceholderHelper("${", "}", ":", true);

    /** Resolves ${VAR:default} placeholders using Spring Environment (env vars / system props). */
    private String resolve(String value) {
        if (value == null) return null;
        return PLACEHOLDER_HELPER.replacePlaceholders(value, key -> env.getProperty(key));
    }

    // ── Sections ──────────────────────────────────────────────────────────────
    private Portfolio portfolio = new Portfolio();
    private Loop loop = new Loop();
    private Risk risk = new Risk();
    private Brain brain = new Brain();
    private Strategy strategy = new Strategy();
    private Ledger ledger = new Ledger();
    private Telegram telegram = new Telegram();
    private List<Connector> connectors = List.of();

    @PostConstruct
    public void load() {
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            InputStream is = getClass().getClassLoader().getResourceAsStream(configFile);
            if (is == null) {
                log.warn("Config file '{}' not found on classpath — using defaults", configFile);
                return;
            }
            ConfigRoot root;
            try (is) {
                root = mapper.readValue(is, ConfigRoot.class);
            }
            this.portfolio = root.getPortfolio();
            this.loop      = root.getLoop();
            this.risk      = root.getRisk();
            this.brain     = root.getBrain();
            this.strategy  = root.getStrategy();
            this.ledger    = root.getLedger();
            this.telegram  = root.getTelegram();
            this.connectors = root.getConnectors() != null ? root.getConnectors() : List.of();

            // Resolve ${VAR:default} placeholders that Jackson reads as literal strings
            this.telegram.setBotToken(resolve(this.telegram.getBotToken()));
            this.telegram.setChatId(resolve(this.telegram.getChatId()));
            this.brain.setConfigId(resolve(this.brain.getConfigId()));
            log.info("AgentConfig loaded from '{}': {} connector(s), brain {}",
                configFile, connectors.size(), brain.isEnabled() ? "enabled" : "disabled");
        } catch (Exception e) {
            log.error("Failed to load {} — agent will use defaults: {}", configFile, e.getMessage());
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Portfolio portfolio()          { return portfolio; }
    public Loop loop()                    { return loop; }
    public Risk risk()                    { return risk; }
    public Brain brain()                  { return brain; }
    public Strategy strategy()            { return strategy; }
    public Ledger ledger()                { return ledger; }
    public Telegram telegram()            { return telegram; }
    public List<Connector> connectors()   { return connectors; }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Portfolio portfolio = new Portfolio();
        private Loop loop = new Loop();
        private Risk risk = new Risk();
        private Brain brain = new Brain();
        private Strategy strategy = new Strategy();
        private Ledger ledger = new Ledger();
        private Telegram telegram = new Telegram();
        private List<Connector> connectors = new ArrayList<>();
    }

    @Data public static class Portfolio {
        private double initialEquity = 1000;
        private boolean equityFromVenue = true;   // ask the first connector for its balance at startup
    }

    @Data public static class Loop {
        private long pollingIntervalSeconds = 30;
        private long initialDelaySeconds = 5;
        private double runDurationHours = 168;    // one week
    }

    /** Static defaults for the risk parameters; the Brain overrides the mode-dependent ones. */
    @Data public static class Risk {
        private double riskPerTrade = 0.005;
        private double maxPortfolioExposure = 0.60;
        private double maxNotionalPctHard = 0.20;
        private double atrStopMultiple = 1.5;
        private double tp1RMultiple = 1.0;
        private double tp2RMultiple = 2.5;
        private double tp1ClosePct = 0.5;
        private double tp2ClosePct = 0.5;
        private double breakEvenTriggerR = 0.8;
        private double trailAtrMultiple = 1.2;
        private int maxBarsInTrade = 48;

        public RiskParameters toParameters() {
            return RiskParameters.builder()
                .riskPerTrade(riskPerTrade)
                .maxPortfolioExposure(maxPortfolioExposure)
                .maxNotionalPctHard(maxNotionalPctHard)
                .atrStopMultiple(atrStopMultiple)
                .tp1RMultiple(tp1RMultiple)
                .tp2RMultiple(tp2RMultiple)
                .tp1ClosePct(tp1ClosePct)
                .tp2ClosePct(tp2ClosePct)
                .breakEvenTriggerR(breakEvenTriggerR)
                .trailAtrMultiple(trailAtrMultiple)
                .maxBarsInTrade(maxBarsInTrade)
                .build();
        }
    }

    @Data public static class Brain {
        private boolean enabled = true;
        private String configId = "SAFE_V1";
        private long refreshMinutes = 15;
        private int shortWindow = 50;
        private int baselineWindow = 200;
        private int minTrades = 10;

        // Mode thresholds (fractions for equity change, R-multiples for avg R)
        private double defensiveEquityChange = -0.10;
        private double defensiveAvgR = -0.25;
        private double aggressiveEquityChange = 0.10;
        private double aggressiveAvgR = 0.70;

        // Symbol underperformance filter
        private int symbolMinTrades = 8;
        private double symbolWinRateMargin = 0.20;
        private double symbolAvgRMargin = 0.15;
        private double blockCooldownHours = 48;

        private ModePreset defensive = new ModePreset(0.003, 0.30, 1.0);
        private ModePreset normal = new ModePreset(0.005, 0.60, 1.2);
        private ModePreset aggressive = new ModePreset(0.008, 0.80, 1.0);

        public ModePreset preset(BrainMode mode) {
            return switch (mode) {
                case DEFENSIVE -> defensive;
                case AGGRESSIVE -> aggressive;
                case NORMAL -> normal;
            };
        }
    }

    @Data public static class ModePreset {
        private double riskPerTrade;
        private double maxPortfolioExposure;
        private double trailAtrMultiple;

        public ModePreset() {
        }

        public ModePreset(double riskPerTrade, double maxPortfolioExposure, double trailAtrMultiple) {
            this.riskPerTrade = riskPerTrade;
            this.maxPortfolioExposure = maxPortfolioExposure;
            this.trailAtrMultiple = trailAtrMultiple;
        }
    }

    @Data public static class Strategy {
        private int atrLength = 14;
        private int donchianLength = 20;
        private int trendEmaLength = 200;
        private int adxLength = 14;
        private double adxMin = 18;
        private int rsiLength = 14;
        private double rsiLongMax = 70;
        private double rsiShortMin = 30;
        private boolean fallbackBreakout = true;
        private int fallbackDonchianLength = 4;
    }

    @Data public static class Connector {
        private String name = "bybit";
        private String type = "BYBIT_PAPER";
        private String baseUrl = "https://api.bybit.com";
        private String category = "linear";
        private String timeframe = "1m";
        private int historyBars = 600;
        private TradingHours tradingHours = TradingHours.ALWAYS;
        private List<String> symbols = new ArrayList<>();
        private double paperBalance = 1000;
        private int reentryCooldownBars = 0;
    }

    @Data public static class Ledger {
        private boolean enabled = true;
    }

    @Data public static class Telegram {
        private String botToken = "";
        private String chatId = "";
    }
}
