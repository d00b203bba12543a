package com.jay.trendagent.layer4_risk;

import com.jay.trendagent.config.AgentConfig;
import com.jay.trendagent.layer1_data.ConnectorRegistry;
import com.jay.trendagent.layer1_data.RegisteredConnector;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.OptionalDouble;

/**
 * Account equity and the per-tick entry budget.
 *
 * Equity starts from the first connector's reported balance (when enabled and available)
 * or from config.portfolio.initialEquity, then moves only by realized P&amp;L.
 * Touched only from the tick thread.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioState {

    private final AgentConfig config;
    private final ConnectorRegistry connectorRegistry;

    private double equity;
    private double remainingBudget;

    @PostConstruct
    public void init() {
        this.equity = config.portfolio().getInitialEquity();
        if (!config.portfolio().isEquityFromVenue() || connectorRegistry.connectors().isEmpty()) {
            log.info("Starting equity (config): {}", String.format("%.2f", equity));
            return;
        }
        RegisteredConnector first = connectorRegistry.connectors().get(0);
        try {
            OptionalDouble venue = first.connector().accountEquity();
            if (venue.isPresent() && venue.getAsDouble() > 0) {
                this.equity = venue.getAsDouble();
                log.info("Starting equity ({} balance): {}", first.name(), String.format("%.2f", equity));
            } else {
                log.warn("{} reported no usable balance — using config equity {}", first.name(), equity);
            }
        } catch (Exception e) {
            log.warn("Balance query on {} failed: {} — using config equity {}", first.name(), e.getMessage(), equity);
        }
    }

    public double equity() {
        return equity;
    }

    /** Adds a realized P&amp;L (negative for losses) and returns the new equity. */
    public double applyRealizedPnl(double pnl) {
        equity += pnl;
        return equity;
    }

    public double remainingBudget() {
        return remainingBudget;
    }

    void resetBudget(double budget) {
        this.remainingBudget = Math.max(0, budget);
    }

    /** Charges an accepted entry's notional against this tick's budget. */
    public void consumeBudget(double notional) {
        remainingBudget = Math.max(0, remainingBudget - notional);
    }
}
