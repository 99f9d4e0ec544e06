package in.smcdesk.service.structure;

import in.smcdesk.domain.data.Candle;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * ATR Calculator - Average True Range over a candle series.
 *
 * Calculation Method:
 * - True Range: TR = max(H-L, |H-PC|, |L-PC|)
 * - Seed: simple average of the first 'period' TRs
 * - Wilder's smoothing: ATR_t = ((ATR_{t-1} × (n-1)) + TR_t) / n
 * - Fewer than (period + 1) candles: simple average of the TRs available
 *
 * Result is always ≥ 0, and 0 only for a perfectly flat series.
 */
public final class ATRCalculator {

    private static final int SCALE = 6;

    /**
     * Calculate ATR, falling back to the simple TR average on short series.
     *
     * @param candles Candles in chronological order (oldest first)
     * @param period  ATR period (typically 14)
     * @return ATR value, never null
     */
    public static BigDecimal calculate(List<Candle> candles, int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("ATR period must be positive: " + period);
        }
        if (candles == null || candles.isEmpty()) {
            return BigDecimal.ZERO;
        }
        if (candles.size() == 1) {
            return candles.get(0).range().setScale(SCALE, RoundingMode.HALF_UP);
        }
        if (candles.size() < period + 1) {
            return calculateSimpleTRAverage(candles, 1, candles.size() - 1);
        }
        return calculateWilderATR(candles, period);
    }

    /**
     * Wilder ATR. Requires at least (period + 1) candles.
     */
    static BigDecimal calculateWilderATR(List<Candle> candles, int period) {
        // Step 1: initial ATR as simple average of first 'period' TRs
        BigDecimal atr = calculateSimpleTRAverage(candles, 1, period);

        // Step 2: Wilder's smoothing for remaining candles
        BigDecimal n = BigDecimal.valueOf(period);
        BigDecimal prevFactor = BigDecimal.valueOf(period - 1L);
        for (int i = period + 1; i < candles.size(); i++) {
            BigDecimal tr = calculateTrueRange(candles.get(i), candles.get(i - 1));
            atr = atr.multiply(prevFactor).add(tr).divide(n, SCALE, RoundingMode.HALF_UP);
        }
        return atr;
    }

    /**
     * TR = max(H - L, |H - PC|, |L - PC|)
     */
    public static BigDecimal calculateTrueRange(Candle current, Candle previous) {
        if (current == null || previous == null) {
            throw new IllegalArgumentException("Candles cannot be null");
        }
        BigDecimal prevClose = previous.close();
        BigDecimal highLow = current.high().subtract(current.low());
        BigDecimal highPrevClose = current.high().subtract(prevClose).abs();
        BigDecimal lowPrevClose = current.low().subtract(prevClose).abs();
        return highLow.max(highPrevClose).max(lowPrevClose);
    }

    /**
     * Average TR of candles [start, start + count).
     */
    static BigDecimal calculateSimpleTRAverage(List<Candle> candles, int start, int count) {
        BigDecimal sum = BigDecimal.ZERO;
        for (int i = start; i < start + count; i++) {
            sum = sum.add(calculateTrueRange(candles.get(i), candles.get(i - 1)));
        }
        return sum.divide(BigDecimal.valueOf(count), SCALE, RoundingMode.HALF_UP);
    }

    public static boolean hasSufficientData(List<Candle> candles, int period) {
        return candles != null && candles.size() >= period + 1;
    }

    private ATRCalculator() {}
}
