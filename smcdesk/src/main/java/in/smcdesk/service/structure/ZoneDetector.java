package in.smcdesk.service.structure;

import in.smcdesk.domain.structure.PricePosition;
import in.smcdesk.domain.structure.SwingKind;
import in.smcdesk.domain.structure.SwingPoint;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Zone Detector - Premium / discount zones of the active swing range.
 *
 * Range: most recent swing HIGH to most recent swing LOW.
 * Discount: bottom 38.2% of the range
 * Premium: top 38.2% of the range
 * Equilibrium: the middle
 */
public final class ZoneDetector {

    public static final BigDecimal DISCOUNT_LEVEL = new BigDecimal("0.382");
    public static final BigDecimal PREMIUM_LEVEL = new BigDecimal("0.618");
    public static final BigDecimal RETRACEMENT_LEVEL = new BigDecimal("0.236");

    /**
     * Zone definition result.
     */
    public record Zone(
        BigDecimal high,
        BigDecimal low,
        BigDecimal range,
        BigDecimal discountTop,     // low + 38.2% of range
        BigDecimal premiumBottom    // low + 61.8% of range
    ) {
        /**
         * Position of price in the range as a fraction; below 0 or above 1
         * when price has left the range.
         */
        public BigDecimal fraction(BigDecimal price) {
            return price.subtract(low).divide(range, 6, RoundingMode.HALF_UP);
        }

        public PricePosition positionOf(BigDecimal price) {
            BigDecimal f = fraction(price);
            if (f.compareTo(DISCOUNT_LEVEL) <= 0) return PricePosition.DISCOUNT;
            if (f.compareTo(PREMIUM_LEVEL) >= 0) return PricePosition.PREMIUM;
            return PricePosition.EQUILIBRIUM;
        }

        /**
         * Level at the given fraction of the range measured from the low.
         */
        public BigDecimal levelFromLow(BigDecimal fraction) {
            return low.add(range.multiply(fraction));
        }

        /**
         * Level at the given fraction of the range measured from the high.
         */
        public BigDecimal levelFromHigh(BigDecimal fraction) {
            return high.subtract(range.multiply(fraction));
        }
    }

    /**
     * Zone of the most recent swing range, or null when a swing kind is
     * missing or the range is degenerate (high ≤ low).
     */
    public static Zone calculateZone(List<SwingPoint> swings) {
        BigDecimal high = mostRecent(swings, SwingKind.HIGH);
        BigDecimal low = mostRecent(swings, SwingKind.LOW);
        return calculateZoneFromRange(high, low);
    }

    public static Zone calculateZoneFromRange(BigDecimal high, BigDecimal low) {
        if (high == null || low == null || high.compareTo(low) <= 0) {
            return null;
        }
        BigDecimal range = high.subtract(low);
        return new Zone(high, low, range,
            low.add(range.multiply(DISCOUNT_LEVEL)),
            low.add(range.multiply(PREMIUM_LEVEL)));
    }

    /**
     * Price position; EQUILIBRIUM when there is no usable range.
     */
    public static PricePosition positionOf(Zone zone, BigDecimal price) {
        return zone == null ? PricePosition.EQUILIBRIUM : zone.positionOf(price);
    }

    static BigDecimal mostRecent(List<SwingPoint> swings, SwingKind kind) {
        for (int i = swings.size() - 1; i >= 0; i--) {
            if (swings.get(i).kind() == kind) {
                return swings.get(i).price();
            }
        }
        return null;
    }

    private ZoneDetector() {}
}
