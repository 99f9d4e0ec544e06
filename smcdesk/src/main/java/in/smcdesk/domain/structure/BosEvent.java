package in.smcdesk.domain.structure;

import java.math.BigDecimal;

/**
 * Break of structure: a close beyond a prior swing point.
 *
 * @param level     price of the swing point that was broken
 * @param direction BULLISH when a swing high was closed above, BEARISH for a swing low closed below
 * @param index     index of the candle whose close broke the level
 */
public record BosEvent(BigDecimal level, Bias direction, int index) {
}
