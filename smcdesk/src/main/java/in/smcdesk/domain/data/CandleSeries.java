package in.smcdesk.domain.data;

import java.math.BigDecimal;
import java.util.List;

/**
 * Ordered candles for one instrument and timeframe (oldest first).
 */
public record CandleSeries(
    String symbol,
    Timeframe timeframe,
    List<Candle> candles
) {
    public CandleSeries {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be blank");
        }
        if (timeframe == null) {
            throw new IllegalArgumentException("Timeframe cannot be null");
        }
        candles = candles == null ? List.of() : List.copyOf(candles);

        for (int i = 1; i < candles.size(); i++) {
            if (!candles.get(i).openTime().isAfter(candles.get(i - 1).openTime())) {
                throw new IllegalArgumentException(String.format(
                    "%s %s: openTime not strictly increasing at index %d (%s after %s)",
                    symbol, timeframe.label(), i, candles.get(i).openTime(), candles.get(i - 1).openTime()));
            }
        }
    }

    public int size() {
        return candles.size();
    }

    public boolean isEmpty() {
        return candles.isEmpty();
    }

    public Candle get(int index) {
        return candles.get(index);
    }

    public Candle last() {
        if (candles.isEmpty()) {
            throw new IllegalStateException("Series " + symbol + " is empty");
        }
        return candles.get(candles.size() - 1);
    }

    /**
     * Close of the most recent bar; the reference price for structure analysis.
     */
    public BigDecimal lastClose() {
        return last().close();
    }
}
