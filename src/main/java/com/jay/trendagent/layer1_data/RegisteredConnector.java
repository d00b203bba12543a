package com.jay.trendagent.layer1_data;

import com.jay.trendagent.config.AgentConfig;

/**
 * A live connector together with the configuration section that produced it.
 */
public record RegisteredConnector(ExchangeConnector connector, AgentConfig.Connector settings) {

    public String name() {
        return connector.name();
    }
}
