package in.smcdesk.domain.structure;

import java.math.BigDecimal;

/**
 * Local extremum of a candle series.
 *
 * @param index position of the bar in the series
 * @param price high of the bar for HIGH swings, low for LOW swings
 */
public record SwingPoint(int index, BigDecimal price, SwingKind kind) {
    public boolean isHigh() {
        return kind == SwingKind.HIGH;
    }

    public boolean isLow() {
        return kind == SwingKind.LOW;
    }
}
