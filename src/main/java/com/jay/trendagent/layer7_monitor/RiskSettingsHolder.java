package com.jay.trendagent.layer7_monitor;

import com.jay.trendagent.config.AgentConfig;
import com.jay.trendagent.model.BlockedSymbolSet;
import com.jay.trendagent.model.RiskSettings;
import com.jay.trendagent.model.enums.BrainMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the currently published {@link RiskSettings}. Readers take one snapshot per tick;
 * the Brain replaces it whole.
 */
@Slf4j
@Component
public class RiskSettingsHolder {

    private final AtomicReference<RiskSettings> current;

    public RiskSettingsHolder(AgentConfig config) {
        this.current = new AtomicReference<>(new RiskSettings(
            0, BrainMode.NORMAL, config.risk().toParameters(), BlockedSymbolSet.empty(), null));
    }

    public RiskSettings current() {
        return current.get();
    }

    public void publish(RiskSettings settings) {
        RiskSettings previous = current.getAndSet(settings);
        log.info("Risk settings v{} published: mode {} → {}, {} blocked symbol(s)",
            settings.getVersion(), previous.getMode(), settings.getMode(), settings.getBlockedSymbols().size());
    }
}
