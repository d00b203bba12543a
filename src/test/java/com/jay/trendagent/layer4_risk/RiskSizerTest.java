package com.jay.trendagent.layer4_risk;

import com.jay.trendagent.model.VenueLimits;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RiskSizerTest {

    private final RiskSizer sizer = new RiskSizer();
    private static final VenueLimits FINE_STEP = new VenueLimits(0, 0, 0.001);

    @Test
    void shouldSizeFromRiskBudget() {
        // 10_000 × 0.5% / 5 = 10 units; cap 20, budget 60
        double qty = sizer.size(10_000, 0.005, 5, 100, 0.20, 6_000, FINE_STEP);

        assertThat(qty).isEqualTo(10.0);
    }

    @Test
    void shouldCapAtHardNotionalFraction() {
        // risk qty 100, hard cap 10_000 × 0.2 / 100 = 20
        double qty = sizer.size(10_000, 0.05, 5, 100, 0.20, 50_000, FINE_STEP);

        assertThat(qty).isEqualTo(20.0);
    }

    @Test
    void shouldCapAtRemainingBudget() {
        double qty = sizer.size(10_000, 0.005, 5, 100, 0.20, 450, FINE_STEP);

        assertThat(qty).isEqualTo(4.5);
    }

    @Test
    void shouldFloorToQuantityStep() {
        // 1000 × 0.01 / 3 = 3.333…
        double qty = sizer.size(1_000, 0.01, 3, 10, 1.0, 1_000, new VenueLimits(0, 0, 0.1));

        assertThat(qty).isEqualTo(3.3);
    }

    @Test
    void shouldRaiseToVenueMinimumWhenBudgetAllows() {
        // risk qty 0.5, venue minimum 1
        double qty = sizer.size(1_000, 0.005, 10, 50, 1.0, 500, new VenueLimits(1, 0, 0.01));

        assertThat(qty).isEqualTo(1.0);
    }

    @Test
    void shouldReturnZeroWhenVenueMinimumDoesNotFitBudget() {
        double qty = sizer.size(1_000, 0.005, 10, 50, 1.0, 40, new VenueLimits(1, 0, 0.01));

        assertThat(qty).isZero();
    }

    @Test
    void shouldRaiseToMinimumNotional() {
        // risk qty 0.25 × 20 = 5 notional, venue wants 10
        double qty = sizer.size(1_000, 0.005, 20, 20, 1.0, 500, new VenueLimits(0, 10, 0.01));

        assertThat(qty).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void shouldReturnZeroWhenBudgetExhausted() {
        assertThat(sizer.size(10_000, 0.005, 5, 100, 0.20, 0, FINE_STEP)).isZero();
    }

    @Test
    void shouldBeDeterministic() {
        double first = sizer.size(12_345.67, 0.008, 1.37, 42.1, 0.2, 3_000, new VenueLimits(0.01, 5, 0.01));
        double second = sizer.size(12_345.67, 0.008, 1.37, 42.1, 0.2, 3_000, new VenueLimits(0.01, 5, 0.01));

        assertThat(first).isEqualTo(second);
    }

    @Test
    void shouldRejectNonPositiveStopDistanceOrPrice() {
        assertThatThrownBy(() -> sizer.size(1_000, 0.01, 0, 100, 0.2, 500, FINE_STEP))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> sizer.size(1_000, 0.01, 1, -1, 0.2, 500, FINE_STEP))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
