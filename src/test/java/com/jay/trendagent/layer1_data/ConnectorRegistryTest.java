package com.jay.trendagent.layer1_data;

import com.jay.trendagent.config.AgentConfig;
import com.jay.trendagent.model.enums.TradingHours;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectorRegistryTest {

    @Test
    void shouldBuildKnownConnectorsAndSkipTheRest() {
        AgentConfig config = new AgentConfig();
        ReflectionTestUtils.setField(config, "configFile", "config-test.yaml");
        ReflectionTestUtils.setField(config, "env", new MockEnvironment());
        config.load();

        ConnectorRegistry registry = new ConnectorRegistry(config);
        registry.init();

        assertThat(registry.connectors()).hasSize(1);
        RegisteredConnector venue = registry.connectors().get(0);
        assertThat(venue.name()).isEqualTo("bybit-spot");
        assertThat(venue.connector()).isInstanceOf(PaperExchangeConnector.class);
        assertThat(venue.connector().tradingHours()).isEqualTo(TradingHours.ALWAYS);
        assertThat(venue.connector().accountEquity().getAsDouble()).isEqualTo(1_000);
    }

    @Test
    void shouldStartEmptyWithoutConnectors() {
        ConnectorRegistry registry = new ConnectorRegistry(new AgentConfig());
        registry.init();

        assertThat(registry.connectors()).isEmpty();
    }
}
