package com.jay.trendagent.layer4_risk;

import com.jay.trendagent.model.Position;
import com.jay.trendagent.model.RiskParameters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;

/**
 * Layer 4: portfolio exposure gate.
 * Before entries each tick: budget = max(0, equity × maxExposure − open notional),
 * open notional valued at each position's freshest observed price.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExposureController {

    private final PortfolioState portfolio;

    /** Recomputes this tick's entry budget and returns it. */
    public double beginTick(RiskParameters params, Collection<Position> openPositions) {
        double open = openNotional(openPositions);
        double budget = Math.max(0, portfolio.equity() * params.getMaxPortfolioExposure() - open);
        portfolio.resetBudget(budget);
        log.debug("Exposure: equity={} openNotional={} budget={}",
            String.format("%.2f", portfolio.equity()), String.format("%.2f", open), String.format("%.2f", budget));
        return budget;
    }

    public double openNotional(Collection<Position> openPositions) {
        double total = 0;
        for (Position p : openPositions) {
            double price = p.getLastPrice() > 0 ? p.getLastPrice() : p.getEntryPrice();
            total += p.notional(price);
        }
        return total;
    }
}
