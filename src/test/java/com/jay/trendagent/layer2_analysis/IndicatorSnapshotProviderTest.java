package com.jay.trendagent.layer2_analysis;

import com.jay.trendagent.config.AgentConfig;
import com.jay.trendagent.model.BarSnapshot;
import com.jay.trendagent.model.OHLCVBar;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndicatorSnapshotProviderTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private AgentConfig config;
    private IndicatorSnapshotProvider provider;

    @BeforeEach
    void setUp() {
        config = new AgentConfig();
        // unreachable ADX floor keeps the strict setup silent
        config.strategy().setAdxMin(1_000);
        provider = new IndicatorSnapshotProvider(config);
    }

    @Test
    void shouldLeaveAtrUnsetOnShortHistory() {
        BarSnapshot snap = provider.snapshot("BTCUSDT", flatBars(10), "1m");

        assertThat(Double.isNaN(snap.getAtr())).isTrue();
        assertThat(snap.hasUsableAtr()).isFalse();
    }

    @Test
    void shouldUseShortBreakoutWhenStrictSetupNeverFired() {
        List<OHLCVBar> bars = flatBars(30);
        bars.add(bar(30, 100, 106, 100, 105));

        BarSnapshot snap = provider.snapshot("BTCUSDT", bars, "1m");

        assertThat(snap.isLongSignal()).isTrue();
        assertThat(snap.isShortSignal()).isFalse();
        assertThat(snap.getClose()).isEqualTo(105.0);
        assertThat(snap.getTimestamp()).isEqualTo(T0.plus(Duration.ofMinutes(30)));
        assertThat(snap.hasUsableAtr()).isTrue();
        assertThat(snap.getAtr()).isBetween(2.0, 3.0);
    }

    @Test
    void shouldSignalShortOnDownsideBreakout() {
        List<OHLCVBar> bars = flatBars(30);
        bars.add(bar(30, 100, 100, 94, 95));

        BarSnapshot snap = provider.snapshot("BTCUSDT", bars, "1m");

        assertThat(snap.isShortSignal()).isTrue();
        assertThat(snap.isLongSignal()).isFalse();
    }

    @Test
    void shouldStaySilentWithoutFallback() {
        config.strategy().setFallbackBreakout(false);
        List<OHLCVBar> bars = flatBars(30);
        bars.add(bar(30, 100, 106, 100, 105));

        BarSnapshot snap = provider.snapshot("BTCUSDT", bars, "1m");

        assertThat(snap.isLongSignal()).isFalse();
        assertThat(snap.isShortSignal()).isFalse();
    }

    @Test
    void shouldNotSignalInsideRange() {
        BarSnapshot snap = provider.snapshot("BTCUSDT", flatBars(30), "1m");

        assertThat(snap.isLongSignal()).isFalse();
        assertThat(snap.isShortSignal()).isFalse();
    }

    @Test
    void shouldRejectEmptyHistory() {
        assertThatThrownBy(() -> provider.snapshot("BTCUSDT", List.of(), "1m"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldParseTimeframes() {
        assertThat(IndicatorSnapshotProvider.durationOf("1m")).isEqualTo(Duration.ofMinutes(1));
        assertThat(IndicatorSnapshotProvider.durationOf("4h")).isEqualTo(Duration.ofHours(4));
        assertThat(IndicatorSnapshotProvider.durationOf("1d")).isEqualTo(Duration.ofDays(1));
        assertThat(IndicatorSnapshotProvider.durationOf("1w")).isEqualTo(Duration.ofDays(7));
    }

    private static List<OHLCVBar> flatBars(int n) {
        List<OHLCVBar> bars = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            bars.add(bar(i, 100, 101, 99, 100));
        }
        return bars;
    }

    private static OHLCVBar bar(int minute, double open, double high, double low, double close) {
        return new OHLCVBar(T0.plus(Duration.ofMinutes(minute)), open, high, low, close, 10);
    }
}
