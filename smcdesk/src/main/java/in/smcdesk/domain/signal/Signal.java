package in.smcdesk.domain.signal;

import in.smcdesk.domain.data.InstrumentClass;
import in.smcdesk.domain.data.Timeframe;
import in.smcdesk.domain.structure.StructureSnapshot;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Trade setup derived from one structure analysis.
 *
 * Immutable. Confirming a signal creates a Trade; the signal itself never
 * changes. takeProfit2 and takeProfit3 are null when no further structural
 * target exists beyond takeProfit1. structure is null for a signal entered
 * by hand.
 */
public record Signal(
    String signalId,
    String symbol,
    Timeframe timeframe,
    InstrumentClass instrumentClass,
    TradingMode mode,
    String strategy,
    Direction direction,

    // Prices
    BigDecimal currentPrice,
    BigDecimal optimalEntry,
    EntryType entryType,
    BigDecimal stopLoss,
    BigDecimal takeProfit1,
    BigDecimal takeProfit2,
    BigDecimal takeProfit3,
    BigDecimal rrRatio,

    // Quality
    double confidence,
    QualityTier qualityTier,

    StructureSnapshot structure,
    Instant createdAt
) {
    public List<BigDecimal> takeProfits() {
        List<BigDecimal> targets = new ArrayList<>(3);
        targets.add(takeProfit1);
        if (takeProfit2 != null) targets.add(takeProfit2);
        if (takeProfit3 != null) targets.add(takeProfit3);
        return List.copyOf(targets);
    }

    public boolean isLimitEntry() {
        return entryType == EntryType.LIMIT;
    }
}
