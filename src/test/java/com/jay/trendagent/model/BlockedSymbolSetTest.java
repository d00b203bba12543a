package com.jay.trendagent.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BlockedSymbolSetTest {

    private static final Instant T = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant UNTIL = T.plus(Duration.ofHours(48));

    @Test
    void shouldBlockOnHalfOpenInterval() {
        BlockedSymbolSet set = BlockedSymbolSet.of(List.of(new BlockedSymbol("SOLUSDT", UNTIL, "x")));

        assertThat(set.isBlocked("SOLUSDT", T)).isTrue();
        assertThat(set.isBlocked("SOLUSDT", UNTIL.minusMillis(1))).isTrue();
        assertThat(set.isBlocked("SOLUSDT", UNTIL)).isFalse();
        assertThat(set.isBlocked("BTCUSDT", T)).isFalse();
    }

    @Test
    void shouldKeepLongerBlockWhenSymbolIsFlaggedAgain() {
        BlockedSymbolSet set = BlockedSymbolSet.empty()
            .with(new BlockedSymbol("SOLUSDT", UNTIL, "first"))
            .with(new BlockedSymbol("SOLUSDT", T.plus(Duration.ofHours(1)), "shorter"));

        assertThat(set.entries()).singleElement()
            .satisfies(b -> assertThat(b.reason()).isEqualTo("first"));

        BlockedSymbolSet extended = set.with(new BlockedSymbol("SOLUSDT", UNTIL.plusSeconds(60), "later"));
        assertThat(extended.isBlocked("SOLUSDT", UNTIL)).isTrue();
    }

    @Test
    void shouldNeverShortenOpenEndedBlock() {
        BlockedSymbolSet set = BlockedSymbolSet.empty()
            .with(new BlockedSymbol("XRPUSDT", null, "manual"))
            .with(new BlockedSymbol("XRPUSDT", UNTIL, "auto"));

        assertThat(set.isBlocked("XRPUSDT", UNTIL.plus(Duration.ofDays(365)))).isTrue();
    }

    @Test
    void shouldLeaveOriginalUntouchedOnMutation() {
        BlockedSymbolSet original = BlockedSymbolSet.empty();
        BlockedSymbolSet added = original.with(new BlockedSymbol("ETHUSDT", UNTIL, "x"));

        assertThat(original.size()).isZero();
        assertThat(added.size()).isEqualTo(1);
    }

    @Test
    void shouldDropExpiredAndMergeActive() {
        BlockedSymbolSet a = BlockedSymbolSet.of(List.of(
            new BlockedSymbol("ETHUSDT", T.plusSeconds(10), "old"),
            new BlockedSymbol("SOLUSDT", UNTIL, "x")));
        BlockedSymbolSet b = BlockedSymbolSet.of(List.of(new BlockedSymbol("XRPUSDT", UNTIL, "y")));

        BlockedSymbolSet merged = a.withoutExpired(T.plusSeconds(10)).merge(b);

        assertThat(merged.activeSymbols(T.plusSeconds(10))).containsExactly("SOLUSDT", "XRPUSDT");
        assertThat(merged.size()).isEqualTo(2);
    }
}
