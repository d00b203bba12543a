package com.jay.trendagent.config;

import com.jay.trendagent.ledger.JpaLedgerStore;
import com.jay.trendagent.ledger.LedgerStore;
import com.jay.trendagent.ledger.NoOpLedgerStore;
import com.jay.trendagent.repository.BrainSnapshotRepository;
import com.jay.trendagent.repository.EquityPointRepository;
import com.jay.trendagent.repository.LiveTradeRecordRepository;
import com.jay.trendagent.repository.SymbolOverrideRepository;
import com.jay.trendagent.repository.TradeEventRecordRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class LedgerConfiguration {

    @Bean
    public LedgerStore ledgerStore(AgentConfig config,
                                   LiveTradeRecordRepository tradeRepo,
                                   TradeEventRecordRepository eventRepo,
                                   EquityPointRepository equityRepo,
                                   SymbolOverrideRepository overrideRepo,
                                   BrainSnapshotRepository snapshotRepo,
                                   Clock clock) {
        if (!config.ledger().isEnabled()) {
            return new NoOpLedgerStore();
        }
        return new JpaLedgerStore(config.brain().getConfigId(),
            tradeRepo, eventRepo, equityRepo, overrideRepo, snapshotRepo, clock);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
