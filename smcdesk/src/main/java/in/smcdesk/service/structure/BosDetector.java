package in.smcdesk.service.structure;

import in.smcdesk.domain.data.Candle;
import in.smcdesk.domain.structure.Bias;
import in.smcdesk.domain.structure.BosEvent;
import in.smcdesk.domain.structure.SwingPoint;
import in.smcdesk.domain.structure.Trend;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Break-of-structure detection.
 *
 * For every swing in the trend direction (HIGH swings when BULLISH, LOW swings
 * when BEARISH, both when RANGING) the first later close beyond the swing price
 * is a break.
 */
public final class BosDetector {

    /**
     * @return events ordered by the index of the breaking candle
     */
    public static List<BosEvent> detect(List<Candle> candles, List<SwingPoint> swings, Trend trend) {
        List<BosEvent> events = new ArrayList<>();
        for (SwingPoint s : swings) {
            if (s.isHigh() && trend == Trend.BEARISH) continue;
            if (s.isLow() && trend == Trend.BULLISH) continue;

            for (int j = s.index() + 1; j < candles.size(); j++) {
                int cmp = candles.get(j).close().compareTo(s.price());
                if (s.isHigh() && cmp > 0) {
                    events.add(new BosEvent(s.price(), Bias.BULLISH, j));
                    break;
                }
                if (s.isLow() && cmp < 0) {
                    events.add(new BosEvent(s.price(), Bias.BEARISH, j));
                    break;
                }
            }
        }
        // stable sort keeps swing order for breaks on the same candle
        events.sort(Comparator.comparingInt(BosEvent::index));
        return events;
    }

    /**
     * Latest break, or null.
     */
    public static BosEvent lastBos(List<Candle> candles, List<SwingPoint> swings, Trend trend) {
        List<BosEvent> events = detect(candles, swings, trend);
        return events.isEmpty() ? null : events.get(events.size() - 1);
    }

    private BosDetector() {}
}
