package in.smcdesk.service.structure;

import in.smcdesk.domain.data.Candle;
import in.smcdesk.domain.structure.SwingPoint;

import java.math.BigDecimal;
import java.util.List;

/**
 * Nearest unbroken support and resistance.
 *
 * Support: highest swing LOW strictly below price with no later close below it.
 * Resistance: lowest swing HIGH strictly above price with no later close above it.
 */
public final class LevelLocator {

    public static BigDecimal nearestSupport(List<Candle> candles, List<SwingPoint> swings, BigDecimal price) {
        BigDecimal best = null;
        for (SwingPoint s : swings) {
            if (!s.isLow() || s.price().compareTo(price) >= 0) continue;
            if (isBroken(candles, s)) continue;
            if (best == null || s.price().compareTo(best) > 0) {
                best = s.price();
            }
        }
        return best;
    }

    public static BigDecimal nearestResistance(List<Candle> candles, List<SwingPoint> swings, BigDecimal price) {
        BigDecimal best = null;
        for (SwingPoint s : swings) {
            if (!s.isHigh() || s.price().compareTo(price) <= 0) continue;
            if (isBroken(candles, s)) continue;
            if (best == null || s.price().compareTo(best) < 0) {
                best = s.price();
            }
        }
        return best;
    }

    /**
     * A swing is broken once any later candle closes beyond it.
     */
    static boolean isBroken(List<Candle> candles, SwingPoint swing) {
        for (int j = swing.index() + 1; j < candles.size(); j++) {
            int cmp = candles.get(j).close().compareTo(swing.price());
            if (swing.isLow() ? cmp < 0 : cmp > 0) {
                return true;
            }
        }
        return false;
    }

    private LevelLocator() {}
}
