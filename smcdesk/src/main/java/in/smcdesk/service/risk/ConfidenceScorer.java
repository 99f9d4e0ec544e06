package in.smcdesk.service.risk;

import in.smcdesk.domain.signal.Direction;
import in.smcdesk.domain.structure.PricePosition;
import in.smcdesk.domain.structure.Trend;

import java.math.BigDecimal;

/**
 * Confidence = 40 × trend alignment + 30 × min(rr / 4, 1) + 30 × zone proximity,
 * clamped to [0, 100] and rounded to one decimal.
 */
public final class ConfidenceScorer {

    static final double TREND_WEIGHT = 40.0;
    static final double RR_WEIGHT = 30.0;
    static final double ZONE_WEIGHT = 30.0;
    static final double RR_CAP = 4.0;

    public static double score(Trend trend, PricePosition position, Direction direction, BigDecimal rr) {
        double rrTerm = Math.min(rr.doubleValue() / RR_CAP, 1.0);
        double raw = TREND_WEIGHT * trendAlignment(trend, direction)
            + RR_WEIGHT * Math.max(rrTerm, 0.0)
            + ZONE_WEIGHT * zoneProximity(position, direction);
        double clamped = Math.max(0.0, Math.min(100.0, raw));
        return Math.round(clamped * 10.0) / 10.0;
    }

    /**
     * 1 when the trend agrees with the direction, 0.5 when ranging, 0 against.
     */
    static double trendAlignment(Trend trend, Direction direction) {
        if (trend == Trend.RANGING) return 0.5;
        boolean aligned = (trend == Trend.BULLISH && direction == Direction.BUY)
            || (trend == Trend.BEARISH && direction == Direction.SELL);
        return aligned ? 1.0 : 0.0;
    }

    /**
     * Buying in discount or selling in premium scores highest.
     */
    static double zoneProximity(PricePosition position, Direction direction) {
        if (position == PricePosition.EQUILIBRIUM) return 0.6;
        boolean favourable = (position == PricePosition.DISCOUNT && direction == Direction.BUY)
            || (position == PricePosition.PREMIUM && direction == Direction.SELL);
        return favourable ? 1.0 : 0.2;
    }

    private ConfidenceScorer() {}
}
