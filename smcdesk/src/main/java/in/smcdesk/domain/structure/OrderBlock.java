package in.smcdesk.domain.structure;

import java.math.BigDecimal;

/**
 * Last opposite-colour candle before an impulse of three or more candles.
 *
 * @param entryZone   mean threshold of the origin candle (midpoint of its range)
 * @param direction   direction of the impulse that followed
 * @param originIndex index of the origin candle
 * @param zoneHigh    high of the origin candle
 * @param zoneLow     low of the origin candle
 */
public record OrderBlock(
    BigDecimal entryZone,
    Bias direction,
    int originIndex,
    BigDecimal zoneHigh,
    BigDecimal zoneLow
) {
    public boolean contains(BigDecimal price) {
        return price.compareTo(zoneLow) >= 0 && price.compareTo(zoneHigh) <= 0;
    }
}
