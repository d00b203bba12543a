package com.jay.trendagent.ledger;

import com.jay.trendagent.entity.BrainSnapshotRecord;
import com.jay.trendagent.entity.EquityPoint;
import com.jay.trendagent.entity.LiveTradeRecord;
import com.jay.trendagent.entity.SymbolOverride;
import com.jay.trendagent.entity.TradeEventRecord;
import com.jay.trendagent.model.BlockedSymbol;
import com.jay.trendagent.model.Position;
import com.jay.trendagent.model.TradeEvent;
import com.jay.trendagent.model.TradeOutcomeSample;
import com.jay.trendagent.model.enums.BrainMode;
import com.jay.trendagent.model.enums.ExitReason;
import com.jay.trendagent.model.enums.Side;
import com.jay.trendagent.repository.BrainSnapshotRepository;
import com.jay.trendagent.repository.EquityPointRepository;
import com.jay.trendagent.repository.LiveTradeRecordRepository;
import com.jay.trendagent.repository.SymbolOverrideRepository;
import com.jay.trendagent.repository.TradeEventRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Ledger backed by the JPA repositories. All rows are scoped by the Brain config id so that
 * several strategy configurations can share one database.
 */
@Slf4j
@RequiredArgsConstructor
public class JpaLedgerStore implements LedgerStore {

    private final String configId;
    private final LiveTradeRecordRepository tradeRepo;
    private final TradeEventRecordRepository eventRepo;
    private final EquityPointRepository equityRepo;
    private final SymbolOverrideRepository overrideRepo;
    private final BrainSnapshotRepository snapshotRepo;
    private final Clock clock;

    @Override
    public String recordTradeOpen(Position position, double equityAtEntry) {
        String tradeId = "TRD-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
        tradeRepo.save(LiveTradeRecord.builder()
            .tradeId(tradeId)
            .configId(configId)
            .connector(position.getKey().connector())
            .symbol(position.getKey().symbol())
            .side(position.getSide().name())
            .entryPrice(position.getEntryPrice())
            .quantity(position.getOriginalQuantity())
            .stopPrice(position.getInitialStopPrice())
            .tp1Price(position.getTp1Price())
            .tp2Price(position.getTp2Price())
            .riskUsd(position.riskAtEntry())
            .equityAtEntry(equityAtEntry)
            .entryOrderId(position.getEntryOrderId())
            .openedAt(position.getOpenedAt())
            .build());
        return tradeId;
    }

    @Override
    public void recordTradeEvent(TradeEvent event, String tradeId) {
        eventRepo.save(TradeEventRecord.builder()
            .tradeId(tradeId)
            .eventTime(event.time())
            .connector(event.key().connector())
            .symbol(event.key().symbol())
            .eventType(event.type())
            .side(event.side().name())
            .price(event.price())
            .quantity(event.quantity())
            .pnl(event.pnl())
            .equity(event.equityAfter())
            .build());
    }

    @Override
    public void recordTradeClose(String tradeId, double exitPrice, double realizedPnl,
                                 ExitReason reason, double equityAtExit, Instant closedAt) {
        if (tradeId == null) {
            log.debug("Close without ledger trade id — nothing to finalize");
            return;
        }
        LiveTradeRecord record = tradeRepo.findById(tradeId)
            .orElseThrow(() -> new IllegalStateException("Unknown trade id " + tradeId));
        record.setExitPrice(exitPrice);
        record.setRealizedPnl(realizedPnl);
        record.setExitType(reason.name());
        record.setEquityAtExit(equityAtExit);
        record.setClosedAt(closedAt);
        tradeRepo.save(record);
    }

    @Override
    public List<TradeOutcomeSample> readRecentClosedTrades(int limit) {
        return tradeRepo.findRecentClosed(configId, PageRequest.of(0, limit)).stream()
            .map(JpaLedgerStore::toSample)
            .toList();
    }

    @Override
    public List<BlockedSymbol> readBlockedSymbols() {
        return overrideRepo.findByConfigIdAndBlockedTrue(configId).stream()
            .map(o -> new BlockedSymbol(o.getSymbol(), o.getBlockUntil(), o.getNote()))
            .toList();
    }

    @Override
    public void writeBlockedSymbol(String symbol, Instant expiry, String reason) {
        overrideRepo.save(SymbolOverride.builder()
            .configId(configId)
            .symbol(symbol)
            .blocked(true)
            .blockUntil(expiry)
            .note(reason)
            .createdAt(clock.instant())
            .build());
    }

    @Override
    public void recordEquity(Instant time, double equity) {
        equityRepo.save(EquityPoint.builder()
            .configId(configId)
            .pointTime(time)
            .equity(equity)
            .build());
    }

    @Override
    public void recordBrainSnapshot(BrainMode mode, String payloadJson, Instant at) {
        snapshotRepo.save(BrainSnapshotRecord.builder()
            .configId(configId)
            .createdAt(at)
            .mode(mode.name())
            .payload(payloadJson)
            .build());
    }

    private static TradeOutcomeSample toSample(LiveTradeRecord t) {
        return new TradeOutcomeSample(
            t.getSymbol(),
            Side.valueOf(t.getSide()),
            t.getEntryPrice(),
            t.getExitPrice() != null ? t.getExitPrice() : 0,
            t.getQuantity(),
            t.getRealizedPnl() != null ? t.getRealizedPnl() : 0,
            t.getRiskUsd(),
            t.getEquityAtEntry(),
            t.getEquityAtExit() != null ? t.getEquityAtExit() : 0,
            t.getExitType(),
            t.getClosedAt()
        );
    }
}
