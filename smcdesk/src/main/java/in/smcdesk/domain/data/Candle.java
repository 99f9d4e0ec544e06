package in.smcdesk.domain.data;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * OHLC candle, already normalized by the market-data collaborator.
 *
 * Invariant: low ≤ min(open, close) ≤ max(open, close) ≤ high.
 */
public record Candle(
    Instant openTime,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close
) {
    private static final MathContext MC = new MathContext(10, RoundingMode.HALF_UP);

    public Candle {
        if (openTime == null || open == null || high == null || low == null || close == null) {
            throw new IllegalArgumentException("Candle fields cannot be null");
        }
        BigDecimal bodyLow = open.min(close);
        BigDecimal bodyHigh = open.max(close);
        if (low.compareTo(bodyLow) > 0 || bodyHigh.compareTo(high) > 0) {
            throw new IllegalArgumentException(String.format(
                "Candle at %s violates low<=body<=high: o=%s h=%s l=%s c=%s",
                openTime, open, high, low, close));
        }
    }

    /**
     * Create candle from raw values.
     */
    public static Candle of(Instant openTime, double o, double h, double l, double c) {
        return new Candle(openTime,
            BigDecimal.valueOf(o), BigDecimal.valueOf(h),
            BigDecimal.valueOf(l), BigDecimal.valueOf(c));
    }

    /**
     * Check if candle is bullish (close > open).
     */
    public boolean isBullish() {
        return close.compareTo(open) > 0;
    }

    /**
     * Check if candle is bearish (close < open).
     */
    public boolean isBearish() {
        return close.compareTo(open) < 0;
    }

    public BigDecimal range() {
        return high.subtract(low);
    }

    /**
     * Mean threshold: midpoint of the candle's full range.
     */
    public BigDecimal midpoint() {
        return high.add(low).divide(BigDecimal.valueOf(2), MC);
    }

    public boolean contains(BigDecimal price) {
        return price.compareTo(low) >= 0 && price.compareTo(high) <= 0;
    }
}
