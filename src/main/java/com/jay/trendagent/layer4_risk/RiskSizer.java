package com.jay.trendagent.layer4_risk;

import com.jay.trendagent.model.VenueLimits;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Layer 4: converts a risk budget into an order quantity.
 *
 * <pre>
 *   qty = equity × riskFraction / stopDistance
 *   qty = min(qty, equity × capFraction / price, remainingBudget / price)
 *   floor to the venue step, then honour the venue minimum quantity and notional
 * </pre>
 *
 * Stateless and deterministic: equal inputs always give the same quantity.
 * A result of 0 means "do not trade".
 */
@Component
public class RiskSizer {

    private static final MathContext PRECISION = new MathContext(12);

    public double size(double equity,
                       double riskFraction,
                       double stopDistance,
                       double price,
                       double capFraction,
                       double remainingBudget,
                       VenueLimits limits) {
        if (stopDistance <= 0) {
            throw new IllegalArgumentException("stopDistance must be positive: " + stopDistance);
        }
        if (price <= 0) {
            throw new IllegalArgumentException("price must be positive: " + price);
        }
        if (equity <= 0 || riskFraction <= 0 || capFraction <= 0 || remainingBudget <= 0) {
            return 0;
        }

        double step = limits.quantityStep() > 0 ? limits.quantityStep() : VenueLimits.DEFAULT_STEP;

        double qty = equity * riskFraction / stopDistance;
        qty = Math.min(qty, equity * capFraction / price);
        qty = Math.min(qty, remainingBudget / price);
        qty = floorToStep(qty, step);

        if (limits.minQuantity() > 0 && qty < limits.minQuantity()) {
            double raised = ceilToStep(limits.minQuantity(), step);
            if (raised * price > remainingBudget) {
                return 0;
            }
            qty = raised;
        }

        if (qty > 0 && limits.minNotional() > 0 && qty * price < limits.minNotional()) {
            qty = ceilToStep(limits.minNotional() / price, step);
        }
        return Math.max(qty, 0);
    }

    public static double floorToStep(double value, double step) {
        return toStep(value, step, RoundingMode.FLOOR);
    }

    public static double ceilToStep(double value, double step) {
        return toStep(value, step, RoundingMode.CEILING);
    }

    /** Rounds to 12 significant digits first so binary noise (0.30000000000000004) never crosses a step. */
    private static double toStep(double value, double step, RoundingMode mode) {
        BigDecimal s = BigDecimal.valueOf(step > 0 ? step : VenueLimits.DEFAULT_STEP);
        BigDecimal units = BigDecimal.valueOf(value).round(PRECISION).divide(s, 0, mode);
        return units.multiply(s).doubleValue();
    }
}
