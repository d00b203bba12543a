package com.jay.trendagent.layer1_data;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.trendagent.config.AgentConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Builds the configured connectors once at startup, in config order.
 * Unknown types and connectors that fail to initialise are skipped with a warning.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectorRegistry {

    static final String BYBIT_PAPER = "BYBIT_PAPER";

    private final AgentConfig config;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private OkHttpClient http;
    private List<RegisteredConnector> connectors = List.of();

    @PostConstruct
    public void init() {
        this.http = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(30, TimeUnit.SECONDS)
            .build();

        List<RegisteredConnector> built = new ArrayList<>();
        for (AgentConfig.Connector settings : config.connectors()) {
            try {
                ExchangeConnector connector = create(settings);
                if (connector == null) {
                    log.warn("Unknown connector type '{}' for '{}' — skipped", settings.getType(), settings.getName());
                    continue;
                }
                built.add(new RegisteredConnector(connector, settings));
                log.info("Connector '{}' ({}) ready: {} symbol(s), timeframe {}",
                    settings.getName(), settings.getType(), settings.getSymbols().size(), settings.getTimeframe());
            } catch (Exception e) {
                log.warn("Connector '{}' failed to initialise: {} — skipped", settings.getName(), e.getMessage());
            }
        }
        this.connectors = Collections.unmodifiableList(built);
        if (connectors.isEmpty()) {
            log.warn("No connectors available — the loop will only manage Brain refreshes");
        }
    }

    private ExchangeConnector create(AgentConfig.Connector settings) {
        if (!BYBIT_PAPER.equalsIgnoreCase(settings.getType())) {
            return null;
        }
        BybitMarketDataClient data = new BybitMarketDataClient(
            http, objectMapper, settings.getBaseUrl(), settings.getCategory());
        return new PaperExchangeConnector(
            settings.getName(), data, settings.getTradingHours(), settings.getPaperBalance());
    }

    /** Active connectors in configuration order. */
    public List<RegisteredConnector> connectors() {
        return connectors;
    }
}
