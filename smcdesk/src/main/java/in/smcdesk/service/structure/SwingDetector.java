package in.smcdesk.service.structure;

import in.smcdesk.domain.data.Candle;
import in.smcdesk.domain.structure.SwingKind;
import in.smcdesk.domain.structure.SwingPoint;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Swing point detection with a symmetric window of k bars.
 *
 * Bar i (k ≤ i ≤ n-1-k) is a swing HIGH when its high is ≥ every high in
 * [i-k, i+k] and strictly greater than every high before it in that window,
 * so the first bar of a flat top wins. LOW is symmetric.
 *
 * An outside bar (both extremes of its window) yields one swing only: the
 * kind opposite to the previous swing, or with no previous swing the extreme
 * its colour printed last (HIGH for a bullish bar, LOW otherwise).
 *
 * Output is strictly increasing by index and alternates kinds: consecutive
 * swings of the same kind collapse into the most extreme one (latest wins on
 * equal price).
 */
public final class SwingDetector {

    public static List<SwingPoint> detect(List<Candle> candles, int window) {
        if (window < 1) {
            throw new IllegalArgumentException("Swing window must be >= 1: " + window);
        }
        List<SwingPoint> raw = new ArrayList<>();
        int n = candles.size();
        for (int i = window; i <= n - 1 - window; i++) {
            Candle bar = candles.get(i);
            boolean high = isSwingHigh(candles, i, window);
            boolean low = isSwingLow(candles, i, window);

            if (high && low) {
                SwingKind kind = outsideBarKind(raw, bar);
                raw.add(new SwingPoint(i, kind == SwingKind.HIGH ? bar.high() : bar.low(), kind));
            } else if (high) {
                raw.add(new SwingPoint(i, bar.high(), SwingKind.HIGH));
            } else if (low) {
                raw.add(new SwingPoint(i, bar.low(), SwingKind.LOW));
            }
        }
        return collapse(raw);
    }

    private static SwingKind outsideBarKind(List<SwingPoint> raw, Candle bar) {
        if (!raw.isEmpty()) {
            return raw.get(raw.size() - 1).isHigh() ? SwingKind.LOW : SwingKind.HIGH;
        }
        return bar.isBullish() ? SwingKind.HIGH : SwingKind.LOW;
    }

    static boolean isSwingHigh(List<Candle> candles, int i, int window) {
        BigDecimal h = candles.get(i).high();
        for (int j = i - window; j <= i + window; j++) {
            if (j == i) continue;
            int cmp = h.compareTo(candles.get(j).high());
            if (cmp < 0 || (j < i && cmp == 0)) {
                return false;
            }
        }
        return true;
    }

    static boolean isSwingLow(List<Candle> candles, int i, int window) {
        BigDecimal l = candles.get(i).low();
        for (int j = i - window; j <= i + window; j++) {
            if (j == i) continue;
            int cmp = l.compareTo(candles.get(j).low());
            if (cmp > 0 || (j < i && cmp == 0)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Merge runs of same-kind swings into their extreme.
     */
    static List<SwingPoint> collapse(List<SwingPoint> raw) {
        List<SwingPoint> result = new ArrayList<>(raw.size());
        for (SwingPoint p : raw) {
            if (result.isEmpty()) {
                result.add(p);
                continue;
            }
            SwingPoint last = result.get(result.size() - 1);
            if (last.kind() != p.kind()) {
                result.add(p);
            } else if (isAtLeastAsExtreme(p, last)) {
                result.set(result.size() - 1, p);
            }
        }
        return result;
    }

    private static boolean isAtLeastAsExtreme(SwingPoint candidate, SwingPoint current) {
        int cmp = candidate.price().compareTo(current.price());
        return candidate.isHigh() ? cmp >= 0 : cmp <= 0;
    }

    private SwingDetector() {}
}
