package in.smcdesk.domain.signal;

import java.math.BigDecimal;

/**
 * Entry, stop and targets computed for one direction.
 *
 * Invariant for BUY: stopLoss < optimalEntry < takeProfit1 (< takeProfit2 < takeProfit3
 * when present). Mirrored for SELL.
 */
public record TradeLevels(
    Direction direction,
    BigDecimal optimalEntry,
    EntryType entryType,
    BigDecimal stopLoss,
    BigDecimal takeProfit1,
    BigDecimal takeProfit2,
    BigDecimal takeProfit3,
    BigDecimal rrRatio,
    double confidence,
    QualityTier qualityTier
) {
    public BigDecimal risk() {
        return optimalEntry.subtract(stopLoss).abs();
    }

    public BigDecimal reward() {
        return takeProfit1.subtract(optimalEntry).abs();
    }
}
