package in.smcdesk.service.structure;

import in.smcdesk.domain.structure.SwingPoint;
import in.smcdesk.domain.structure.Trend;

import java.math.BigDecimal;
import java.util.List;

/**
 * Trend from the last three swings of each kind.
 *
 * A kind with at least two swings is rising (strictly increasing), falling
 * (strictly decreasing) or mixed. A kind with fewer than two swings has no
 * slope.
 *
 * BULLISH: highs and lows both rising. BEARISH: both falling. Anything else,
 * including a kind with a single swing, is RANGING.
 */
public final class TrendClassifier {

    static final int LOOKBACK = 3;

    private enum Slope { NONE, RISING, FALLING, MIXED }

    public static Trend classify(List<SwingPoint> swings) {
        List<BigDecimal> highs = lastPrices(swings, true);
        List<BigDecimal> lows = lastPrices(swings, false);

        Slope highSlope = slope(highs);
        Slope lowSlope = slope(lows);

        if (highSlope == Slope.RISING && lowSlope == Slope.RISING) return Trend.BULLISH;
        if (highSlope == Slope.FALLING && lowSlope == Slope.FALLING) return Trend.BEARISH;
        return Trend.RANGING;
    }

    private static List<BigDecimal> lastPrices(List<SwingPoint> swings, boolean highs) {
        List<BigDecimal> prices = swings.stream()
            .filter(s -> s.isHigh() == highs)
            .map(SwingPoint::price)
            .toList();
        return prices.subList(Math.max(0, prices.size() - LOOKBACK), prices.size());
    }

    private static Slope slope(List<BigDecimal> prices) {
        if (prices.size() < 2) {
            return Slope.NONE;
        }
        boolean rising = true;
        boolean falling = true;
        for (int i = 1; i < prices.size(); i++) {
            int cmp = prices.get(i).compareTo(prices.get(i - 1));
            if (cmp <= 0) rising = false;
            if (cmp >= 0) falling = false;
        }
        if (rising) return Slope.RISING;
        if (falling) return Slope.FALLING;
        return Slope.MIXED;
    }

    private TrendClassifier() {}
}
