package com.jay.trendagent.config;

import com.jay.trendagent.model.RiskParameters;
import com.jay.trendagent.model.enums.BrainMode;
import com.jay.trendagent.model.enums.TradingHours;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;

class AgentConfigTest {

    @Test
    void shouldLoadSnakeCaseYamlOverDefaults() {
        AgentConfig config = load("config-test.yaml", new MockEnvironment());

        assertThat(config.portfolio().getInitialEquity()).isEqualTo(2_500);
        assertThat(config.portfolio().isEquityFromVenue()).isFalse();
        assertThat(config.loop().getPollingIntervalSeconds()).isEqualTo(10);
        assertThat(config.loop().getInitialDelaySeconds()).isEqualTo(5);
        assertThat(config.strategy().getDonchianLength()).isEqualTo(10);
        assertThat(config.strategy().getAtrLength()).isEqualTo(14);

        RiskParameters params = config.risk().toParameters();
        assertThat(params.getRiskPerTrade()).isEqualTo(0.01);
        assertThat(params.getAtrStopMultiple()).isEqualTo(2.0);
        assertThat(params.getMaxBarsInTrade()).isEqualTo(48);
    }

    @Test
    void shouldReadConnectorList() {
        AgentConfig config = load("config-test.yaml", new MockEnvironment());

        assertThat(config.connectors()).hasSize(2);
        AgentConfig.Connector spot = config.connectors().get(0);
        assertThat(spot.getName()).isEqualTo("bybit-spot");
        assertThat(spot.getCategory()).isEqualTo("spot");
        assertThat(spot.getTimeframe()).isEqualTo("5m");
        assertThat(spot.getReentryCooldownBars()).isEqualTo(2);
        assertThat(spot.getSymbols()).containsExactly("BTCUSDT", "ETHUSDT");
        assertThat(spot.getTradingHours()).isEqualTo(TradingHours.ALWAYS);
        assertThat(config.connectors().get(1).getTradingHours()).isEqualTo(TradingHours.US_EQUITY);
    }

    @Test
    void shouldResolvePlaceholdersFromEnvironment() {
        MockEnvironment env = new MockEnvironment()
            .withProperty("TEST_TG_TOKEN", "bot-token")
            .withProperty("TEST_BRAIN_ID", "LIVE_V2");

        AgentConfig config = load("config-test.yaml", env);

        assertThat(config.telegram().getBotToken()).isEqualTo("bot-token");
        assertThat(config.telegram().getChatId()).isEqualTo("12345");
        assertThat(config.brain().getConfigId()).isEqualTo("LIVE_V2");
    }

    @Test
    void shouldFallBackToPlaceholderDefaults() {
        AgentConfig config = load("config-test.yaml", new MockEnvironment());

        assertThat(config.telegram().getBotToken()).isEmpty();
        assertThat(config.brain().getConfigId()).isEqualTo("TEST_V1");
    }

    @Test
    void shouldMergeModePresetWithDefaults() {
        AgentConfig config = load("config-test.yaml", new MockEnvironment());

        assertThat(config.brain().getMinTrades()).isEqualTo(5);
        assertThat(config.brain().preset(BrainMode.DEFENSIVE).getRiskPerTrade()).isEqualTo(0.002);
        assertThat(config.brain().preset(BrainMode.AGGRESSIVE).getRiskPerTrade()).isEqualTo(0.008);
    }

    @Test
    void shouldKeepDefaultsWhenFileMissing() {
        AgentConfig config = load("does-not-exist.yaml", new MockEnvironment());

        assertThat(config.portfolio().getInitialEquity()).isEqualTo(1_000);
        assertThat(config.connectors()).isEmpty();
        assertThat(config.brain().isEnabled()).isTrue();
    }

    private static AgentConfig load(String file, MockEnvironment env) {
        AgentConfig config = new AgentConfig();
        ReflectionTestUtils.setField(config, "configFile", file);
        ReflectionTestUtils.setField(config, "env", env);
        config.load();
        return config;
    }
}
