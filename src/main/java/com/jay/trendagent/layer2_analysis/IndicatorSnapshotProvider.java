package com.jay.trendagent.layer2_analysis;

import com.jay.trendagent.config.AgentConfig;
import com.jay.trendagent.model.BarSnapshot;
import com.jay.trendagent.model.OHLCVBar;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.indicators.ATRIndicator;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.adx.ADXIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.helpers.HighPriceIndicator;
import org.ta4j.core.indicators.helpers.HighestValueIndicator;
import org.ta4j.core.indicators.helpers.LowPriceIndicator;
import org.ta4j.core.indicators.helpers.LowestValueIndicator;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Layer 2: turns raw bars into a {@link BarSnapshot} using ta4j indicators.
 *
 * Long setup:  close above the previous Donchian high, above the trend EMA, ADX at or above
 *              the floor, RSI at or below the long ceiling.
 * Short setup: the mirror image with the RSI floor.
 *
 * When the strict setup never fired anywhere in the loaded history (quiet markets, short
 * history) a plain short-window Donchian breakout is used instead, if enabled.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IndicatorSnapshotProvider {

    private final AgentConfig config;

    public BarSnapshot snapshot(String symbol, List<OHLCVBar> bars, String timeframe) {
        if (bars == null || bars.isEmpty()) {
            throw new IllegalArgumentException("No bars for " + symbol);
        }
        AgentConfig.Strategy cfg = config.strategy();
        BarSeries series = buildSeries(symbol, bars, durationOf(timeframe));
        int last = series.getEndIndex();

        ClosePriceIndicator close = new ClosePriceIndicator(series);
        HighPriceIndicator high = new HighPriceIndicator(series);
        LowPriceIndicator low = new LowPriceIndicator(series);

        ATRIndicator atr = new ATRIndicator(series, cfg.getAtrLength());
        double atrVal = series.getBarCount() > cfg.getAtrLength()
            ? atr.getValue(last).doubleValue()
            : Double.NaN;

        Setup strict = new Setup(
            close,
            new HighestValueIndicator(high, cfg.getDonchianLength()),
            new LowestValueIndicator(low, cfg.getDonchianLength()),
            new EMAIndicator(close, cfg.getTrendEmaLength()),
            new ADXIndicator(series, cfg.getAdxLength()),
            new RSIIndicator(close, cfg.getRsiLength()),
            cfg);

        boolean longSignal;
        boolean shortSignal;
        if (strict.firedAnywhere(cfg.getDonchianLength(), last) || !cfg.isFallbackBreakout()) {
            longSignal = strict.isLong(last);
            shortSignal = strict.isShort(last);
        } else {
            int fb = cfg.getFallbackDonchianLength();
            HighestValueIndicator fbHigh = new HighestValueIndicator(high, fb);
            LowestValueIndicator fbLow = new LowestValueIndicator(low, fb);
            double c = close.getValue(last).doubleValue();
            longSignal = last > fb && c > fbHigh.getValue(last - 1).doubleValue();
            shortSignal = last > fb && c < fbLow.getValue(last - 1).doubleValue();
            log.debug("{}: strict setup silent over {} bars, using {}-bar breakout", symbol, bars.size(), fb);
        }

        OHLCVBar lastBar = bars.get(bars.size() - 1);
        return BarSnapshot.builder()
            .timestamp(lastBar.getTimestamp())
            .open(lastBar.getOpen())
            .high(lastBar.getHigh())
            .low(lastBar.getLow())
            .close(lastBar.getClose())
            .volume(lastBar.getVolume())
            .atr(atrVal)
            .longSignal(longSignal)
            .shortSignal(shortSignal)
            .build();
    }

    /** The strict trend-breakout rule evaluated at any bar index. */
    private record Setup(ClosePriceIndicator close,
                         HighestValueIndicator donchianHigh,
                         LowestValueIndicator donchianLow,
                         EMAIndicator trendEma,
                         ADXIndicator adx,
                         RSIIndicator rsi,
                         AgentConfig.Strategy cfg) {

        boolean isLong(int i) {
            if (i < 1) return false;
            double c = close.getValue(i).doubleValue();
            return c > donchianHigh.getValue(i - 1).doubleValue()
                && c > trendEma.getValue(i).doubleValue()
                && adx.getValue(i).doubleValue() >= cfg.getAdxMin()
                && rsi.getValue(i).doubleValue() <= cfg.getRsiLongMax();
        }

        boolean isShort(int i) {
            if (i < 1) return false;
            double c = close.getValue(i).doubleValue();
            return c < donchianLow.getValue(i - 1).doubleValue()
                && c < trendEma.getValue(i).doubleValue()
                && adx.getValue(i).doubleValue() >= cfg.getAdxMin()
                && rsi.getValue(i).doubleValue() >= cfg.getRsiShortMin();
        }

        boolean firedAnywhere(int from, int to) {
            for (int i = Math.max(1, from); i <= to; i++) {
                if (isLong(i) || isShort(i)) return true;
            }
            return false;
        }
    }

    /**
     * Builds a ta4j BarSeries; bar end time = open time + bar duration.
     */
    private BarSeries buildSeries(String symbol, List<OHLCVBar> bars, Duration barDuration) {
        BarSeries series = new BaseBarSeriesBuilder().withName(symbol).build();
        for (OHLCVBar bar : bars) {
            ZonedDateTime endTime = bar.getTimestamp().plus(barDuration).atZone(ZoneOffset.UTC);
            series.addBar(barDuration, endTime,
                bar.getOpen(), bar.getHigh(), bar.getLow(), bar.getClose(), bar.getVolume());
        }
        return series;
    }

    /** 1m / 15m / 1h / 4h / 1d style timeframe to a Duration. */
    public static Duration durationOf(String timeframe) {
        String tf = timeframe.trim().toLowerCase();
        long n = Long.parseLong(tf.substring(0, tf.length() - 1));
        return switch (tf.charAt(tf.length() - 1)) {
            case 'm' -> Duration.ofMinutes(n);
            case 'h' -> Duration.ofHours(n);
            case 'd' -> Duration.ofDays(n);
            case 'w' -> Duration.ofDays(7 * n);
            default -> throw new IllegalArgumentException("Unsupported timeframe: " + timeframe);
        };
    }
}
