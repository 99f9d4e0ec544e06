package in.smcdesk.domain.signal;

import in.smcdesk.domain.data.InstrumentClass;
import in.smcdesk.domain.data.Timeframe;

import java.math.BigDecimal;

/**
 * Signal entered by hand rather than derived from candles.
 *
 * Levels must be ordered along the direction: for BUY
 * stopLoss &lt; entryPrice &lt; takeProfit1 &lt; takeProfit2 &lt; takeProfit3, mirrored
 * for SELL. takeProfit3 requires takeProfit2.
 *
 * @param timeframe   null defaults to 1h
 * @param mode        null defaults to intraday
 * @param strategy    blank defaults to "manual"
 * @param confidence  0..100
 */
public record ManualSignalRequest(
    String symbol,
    Direction direction,
    InstrumentClass instrumentClass,
    Timeframe timeframe,
    TradingMode mode,
    String strategy,
    BigDecimal entryPrice,
    BigDecimal stopLoss,
    BigDecimal takeProfit1,
    BigDecimal takeProfit2,
    BigDecimal takeProfit3,
    double confidence
) {
    public ManualSignalRequest {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be blank");
        }
        if (direction == null || !direction.isTradable()) {
            throw new IllegalArgumentException("Direction must be BUY or SELL");
        }
        if (instrumentClass == null) {
            throw new IllegalArgumentException("Market type is required");
        }
        if (entryPrice == null || stopLoss == null || takeProfit1 == null) {
            throw new IllegalArgumentException("entryPrice, stopLoss and takeProfit1 are required");
        }
        if (entryPrice.signum() <= 0 || stopLoss.signum() <= 0 || takeProfit1.signum() <= 0) {
            throw new IllegalArgumentException("Prices must be positive");
        }
        if (takeProfit3 != null && takeProfit2 == null) {
            throw new IllegalArgumentException("takeProfit3 requires takeProfit2");
        }
        if (Double.isNaN(confidence) || confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("Confidence must be within 0..100: " + confidence);
        }

        boolean buy = direction == Direction.BUY;
        requireBeyond(stopLoss, entryPrice, buy, "entryPrice", "stopLoss");
        requireBeyond(entryPrice, takeProfit1, buy, "takeProfit1", "entryPrice");
        if (takeProfit2 != null) {
            requireBeyond(takeProfit1, takeProfit2, buy, "takeProfit2", "takeProfit1");
        }
        if (takeProfit3 != null) {
            requireBeyond(takeProfit2, takeProfit3, buy, "takeProfit3", "takeProfit2");
        }

        if (timeframe == null) {
            timeframe = Timeframe.H1;
        }
        if (mode == null) {
            mode = TradingMode.INTRADAY;
        }
        if (strategy == null || strategy.isBlank()) {
            strategy = "manual";
        }
    }

    /**
     * BUY: upper must be strictly above lower. SELL: strictly below.
     */
    private static void requireBeyond(BigDecimal lower, BigDecimal upper, boolean buy,
                                      String upperName, String lowerName) {
        int cmp = upper.compareTo(lower);
        if (buy ? cmp <= 0 : cmp >= 0) {
            throw new IllegalArgumentException(upperName + " " + upper + " must be "
                + (buy ? "above " : "below ") + lowerName + " " + lower);
        }
    }
}
