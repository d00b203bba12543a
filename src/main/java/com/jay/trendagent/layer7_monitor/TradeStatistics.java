package com.jay.trendagent.layer7_monitor;

import com.jay.trendagent.model.TradeOutcomeSample;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Win rate, average R-multiple and equity change over a window of closed trades.
 * Statistics that cannot be computed are null; callers pick their own fallback.
 */
public record TradeStatistics(int trades, Double winRate, Double avgR, Double equityChange) {

    public static TradeStatistics of(List<TradeOutcomeSample> samples) {
        if (samples.isEmpty()) {
            return new TradeStatistics(0, null, null, null);
        }
        long wins = samples.stream().filter(TradeOutcomeSample::isWin).count();
        double[] rs = samples.stream()
            .filter(TradeOutcomeSample::hasRisk)
            .mapToDouble(TradeOutcomeSample::rMultiple)
            .toArray();

        Double winRate = null;
        Double avgR = null;
        // without any R sample neither figure is trusted
        if (rs.length > 0) {
            winRate = (double) wins / samples.size();
            double sum = 0;
            for (double r : rs) sum += r;
            avgR = sum / rs.length;
        }
        return new TradeStatistics(samples.size(), winRate, avgR, equityChange(samples));
    }

    /**
     * (equity at exit of the newest trade − equity at entry of the oldest) / the latter,
     * by close time. Null with fewer than two trades or non-positive equity figures.
     */
    static Double equityChange(List<TradeOutcomeSample> samples) {
        List<TradeOutcomeSample> ordered = samples.stream()
            .filter(s -> s.closedAt() != null)
            .sorted(Comparator.comparing(TradeOutcomeSample::closedAt))
            .toList();
        if (ordered.size() < 2) return null;

        TradeOutcomeSample first = ordered.get(0);
        TradeOutcomeSample last = ordered.get(ordered.size() - 1);
        double start = first.equityAtEntry() > 0 ? first.equityAtEntry() : first.equityAtExit();
        double end = last.equityAtExit();
        if (start <= 0 || end <= 0) return null;
        return (end - start) / start;
    }

    public double winRateOr(double fallback) {
        return Objects.requireNonNullElse(winRate, fallback);
    }

    public double avgROr(double fallback) {
        return Objects.requireNonNullElse(avgR, fallback);
    }

    public double equityChangeOr(double fallback) {
        return Objects.requireNonNullElse(equityChange, fallback);
    }
}
