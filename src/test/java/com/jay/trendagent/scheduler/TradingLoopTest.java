package com.jay.trendagent.scheduler;

import com.jay.trendagent.config.AgentConfig;
import com.jay.trendagent.layer1_data.ConnectorRegistry;
import com.jay.trendagent.layer1_data.ExchangeConnector;
import com.jay.trendagent.layer1_data.RegisteredConnector;
import com.jay.trendagent.layer2_analysis.IndicatorSnapshotProvider;
import com.jay.trendagent.layer3_signal.EntryEvaluator;
import com.jay.trendagent.layer4_risk.ExposureController;
import com.jay.trendagent.layer4_risk.PortfolioState;
import com.jay.trendagent.layer5_position.PositionBook;
import com.jay.trendagent.layer5_position.PositionStateMachine;
import com.jay.trendagent.layer7_monitor.AdaptiveRiskController;
import com.jay.trendagent.layer7_monitor.RiskSettingsHolder;
import com.jay.trendagent.ledger.LedgerStore;
import com.jay.trendagent.model.BarSnapshot;
import com.jay.trendagent.model.OHLCVBar;
import com.jay.trendagent.model.Position;
import com.jay.trendagent.model.PositionKey;
import com.jay.trendagent.model.enums.Side;
import com.jay.trendagent.model.enums.TradingHours;
import com.jay.trendagent.notification.TelegramService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TradingLoopTest {

    private static final Instant T0 = Instant.parse("2024-03-04T15:00:00Z");
    private static final List<OHLCVBar> BARS = List.of(new OHLCVBar(T0, 100, 101, 99, 100, 1));

    @Mock
    private ConnectorRegistry connectorRegistry;
    @Mock
    private IndicatorSnapshotProvider indicators;
    @Mock
    private PositionStateMachine stateMachine;
    @Mock
    private ExposureController exposureController;
    @Mock
    private EntryEvaluator entryEvaluator;
    @Mock
    private AdaptiveRiskController brain;
    @Mock
    private PortfolioState portfolio;
    @Mock
    private LedgerStore ledger;
    @Mock
    private TelegramService telegramService;
    @Mock
    private ExchangeConnector connector;
    @Mock
    private Clock clock;

    private AgentConfig config;
    private PositionBook book;
    private RiskSettingsHolder settingsHolder;
    private RegisteredConnector venue;
    private TradingLoop loop;

    @BeforeEach
    void setUp() {
        config = new AgentConfig();
        book = new PositionBook();
        settingsHolder = new RiskSettingsHolder(config);
        AgentConfig.Connector settings = new AgentConfig.Connector();
        settings.setSymbols(List.of("BTCUSDT", "ETHUSDT"));
        venue = new RegisteredConnector(connector, settings);
        loop = new TradingLoop(config, connectorRegistry, indicators, book, stateMachine, exposureController,
            entryEvaluator, brain, settingsHolder, portfolio, ledger, telegramService, clock);

        lenient().when(connectorRegistry.connectors()).thenReturn(List.of(venue));
        lenient().when(connector.name()).thenReturn("bybit");
        lenient().when(connector.tradingHours()).thenReturn(TradingHours.ALWAYS);
        lenient().when(portfolio.equity()).thenReturn(1_000.0);
    }

    @Test
    void shouldEvaluateEntriesOnlyOnFreshBars() throws IOException {
        when(clock.instant()).thenReturn(T0, T0.plusSeconds(30), T0.plusSeconds(60));
        when(connector.fetchBars(anyString(), eq("1m"), eq(600))).thenReturn(BARS);
        when(indicators.snapshot(anyString(), eq(BARS), eq("1m")))
            .thenReturn(snapshot(T0), snapshot(T0), snapshot(T0), snapshot(T0),
                snapshot(T0.plusSeconds(60)), snapshot(T0.plusSeconds(60)));

        loop.tick();
        loop.tick();
        loop.tick();

        verify(entryEvaluator, times(2)).evaluate(eq(venue), eq("BTCUSDT"), any(), any(), any());
        verify(entryEvaluator, times(2)).evaluate(eq(venue), eq("ETHUSDT"), any(), any(), any());
        verify(ledger, times(3)).recordEquity(any(), eq(1_000.0));
    }

    @Test
    void shouldManageOpenPositionsBeforeEntries() throws IOException {
        Position open = Position.builder()
            .key(new PositionKey("bybit", "BTCUSDT"))
            .side(Side.LONG)
            .entryPrice(95)
            .originalQuantity(1)
            .remainingQuantity(1)
            .build();
        book.add(open);
        BarSnapshot bar = snapshot(T0);
        when(clock.instant()).thenReturn(T0);
        when(connector.fetchBars(anyString(), anyString(), anyInt())).thenReturn(BARS);
        when(indicators.snapshot(anyString(), any(), anyString())).thenReturn(bar);

        loop.tick();

        assertThat(open.getLastPrice()).isEqualTo(100.0);
        InOrder order = inOrder(stateMachine, exposureController, entryEvaluator);
        order.verify(stateMachine).onBar(eq(open), eq(bar), eq(venue), any(), eq(T0));
        order.verify(exposureController).beginTick(any(), any());
        order.verify(entryEvaluator).evaluate(eq(venue), eq("BTCUSDT"), eq(bar), any(), eq(T0));
    }

    @Test
    void shouldSkipConnectorOutsideTradingHours() throws IOException {
        // Saturday
        when(clock.instant()).thenReturn(Instant.parse("2024-03-02T15:00:00Z"));
        when(connector.tradingHours()).thenReturn(TradingHours.US_EQUITY);

        loop.tick();

        verify(connector, never()).fetchBars(anyString(), anyString(), anyInt());
        verify(entryEvaluator, never()).evaluate(any(), anyString(), any(), any(), any());
    }

    @Test
    void shouldKeepGoingWhenOneSymbolFails() throws IOException {
        when(clock.instant()).thenReturn(T0);
        when(connector.fetchBars(eq("BTCUSDT"), anyString(), anyInt())).thenThrow(new IOException("timeout"));
        when(connector.fetchBars(eq("ETHUSDT"), anyString(), anyInt())).thenReturn(BARS);
        when(indicators.snapshot(eq("ETHUSDT"), any(), anyString())).thenReturn(snapshot(T0));

        loop.tick();

        verify(entryEvaluator, never()).evaluate(any(), eq("BTCUSDT"), any(), any(), any());
        verify(entryEvaluator).evaluate(eq(venue), eq("ETHUSDT"), any(), any(), eq(T0));
    }

    @Test
    void shouldStopOnceRunDurationElapsed() throws IOException {
        config.loop().setRunDurationHours(1);
        when(clock.instant()).thenReturn(T0, T0.plus(Duration.ofMinutes(60)));
        when(connector.fetchBars(anyString(), anyString(), anyInt())).thenReturn(BARS);
        when(indicators.snapshot(anyString(), any(), anyString())).thenReturn(snapshot(T0));

        loop.tick();
        loop.tick();
        loop.scheduledTick();

        assertThat(loop.isStopped()).isTrue();
        verify(brain, times(1)).refreshIfDue(any());
        verify(telegramService).sendAlert(contains("STOPPED"), anyString());
        verify(clock, times(2)).instant();
    }

    @Test
    void shouldStillTradeWhenBrainRefreshThrows() throws IOException {
        when(clock.instant()).thenReturn(T0);
        when(brain.refreshIfDue(T0)).thenThrow(new IllegalStateException("ledger offline"));
        when(connector.fetchBars(anyString(), anyString(), anyInt())).thenReturn(BARS);
        when(indicators.snapshot(anyString(), any(), anyString())).thenReturn(snapshot(T0));

        loop.tick();

        verify(entryEvaluator, times(2)).evaluate(eq(venue), anyString(), any(), eq(settingsHolder.current()), eq(T0));
        verify(exposureController).beginTick(eq(settingsHolder.current().getParameters()), any());
    }

    private static BarSnapshot snapshot(Instant time) {
        return BarSnapshot.builder()
            .timestamp(time)
            .open(100).high(101).low(99).close(100)
            .volume(1)
            .atr(2)
            .build();
    }
}
