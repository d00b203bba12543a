package com.jay.trendagent.layer4_risk;

import com.jay.trendagent.config.AgentConfig;
import com.jay.trendagent.layer1_data.ConnectorRegistry;
import com.jay.trendagent.model.Position;
import com.jay.trendagent.model.PositionKey;
import com.jay.trendagent.model.RiskParameters;
import com.jay.trendagent.model.enums.Side;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@ExtendWith(MockitoExtension.class)
class ExposureControllerTest {

    @Mock
    private ConnectorRegistry connectorRegistry;

    private PortfolioState portfolio;
    private ExposureController controller;
    private RiskParameters params;

    @BeforeEach
    void setUp() {
        AgentConfig config = new AgentConfig();
        config.portfolio().setInitialEquity(10_000);
        config.portfolio().setEquityFromVenue(false);
        portfolio = new PortfolioState(config, connectorRegistry);
        portfolio.init();
        controller = new ExposureController(portfolio);
        params = config.risk().toParameters();   // max exposure 0.60
    }

    @Test
    void shouldGiveFullBudgetWithNoOpenPositions() {
        assertThat(controller.beginTick(params, List.of())).isEqualTo(6_000.0);
        assertThat(portfolio.remainingBudget()).isEqualTo(6_000.0);
    }

    @Test
    void shouldValueOpenPositionsAtFreshestPrice() {
        Position btc = position("BTCUSDT", 0.05, 60_000, 62_000);   // 3_100 at last price
        Position eth = position("ETHUSDT", 1.0, 2_000, 0);         // no last price yet → entry

        double budget = controller.beginTick(params, List.of(btc, eth));

        assertThat(budget).isCloseTo(900.0, within(1e-9));
    }

    @Test
    void shouldNeverGoNegative() {
        Position big = position("BTCUSDT", 1, 60_000, 60_000);

        assertThat(controller.beginTick(params, List.of(big))).isZero();
    }

    @Test
    void shouldDecrementBudgetPerAcceptedEntry() {
        controller.beginTick(params, List.of());

        portfolio.consumeBudget(2_500);
        portfolio.consumeBudget(4_000);

        assertThat(portfolio.remainingBudget()).isZero();
    }

    private static Position position(String symbol, double qty, double entry, double last) {
        return Position.builder()
            .key(new PositionKey("bybit", symbol))
            .side(Side.LONG)
            .entryPrice(entry)
            .originalQuantity(qty)
            .remainingQuantity(qty)
            .lastPrice(last)
            .build();
    }
}
