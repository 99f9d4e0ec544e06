package in.smcdesk.domain.structure;

import java.math.BigDecimal;
import java.util.List;

/**
 * Structural read of a candle series. Derived and immutable; recomputed on
 * every analysis call.
 *
 * Nullable components: nearestSupport, nearestResistance, lastBos, rangeHigh,
 * rangeLow. A null anchor means no unbroken swing exists on that side.
 */
public record StructureSnapshot(
    Trend trend,
    PricePosition pricePosition,
    BigDecimal currentPrice,
    BigDecimal nearestSupport,
    BigDecimal nearestResistance,
    BigDecimal atr,
    List<SwingPoint> swingPoints,
    List<OrderBlock> orderBlocks,
    BosEvent lastBos,
    BigDecimal rangeHigh,
    BigDecimal rangeLow
) {
    public StructureSnapshot {
        swingPoints = swingPoints == null ? List.of() : List.copyOf(swingPoints);
        orderBlocks = orderBlocks == null ? List.of() : List.copyOf(orderBlocks);
    }

    public boolean hasSupport() {
        return nearestSupport != null;
    }

    public boolean hasResistance() {
        return nearestResistance != null;
    }

    /**
     * True when both ends of the swing range are known and distinct.
     */
    public boolean hasRange() {
        return rangeHigh != null && rangeLow != null && rangeHigh.compareTo(rangeLow) > 0;
    }

    public List<SwingPoint> swingHighs() {
        return swingPoints.stream().filter(SwingPoint::isHigh).toList();
    }

    public List<SwingPoint> swingLows() {
        return swingPoints.stream().filter(SwingPoint::isLow).toList();
    }
}
