package in.smcdesk.service.structure;

import in.smcdesk.domain.data.Candle;
import in.smcdesk.domain.structure.Bias;
import in.smcdesk.domain.structure.OrderBlock;

import java.util.ArrayList;
import java.util.List;

/**
 * Order block detection.
 *
 * An order block is the opposite-colour candle immediately preceding an
 * impulse of at least {@code MIN_IMPULSE} consecutive same-colour candles.
 * A bearish candle before a bullish impulse is a BULLISH block and vice versa.
 * Dojis (close == open) break an impulse.
 */
public final class OrderBlockDetector {

    static final int MIN_IMPULSE = 3;

    /**
     * @return blocks ordered by origin index (oldest first)
     */
    public static List<OrderBlock> detect(List<Candle> candles) {
        List<OrderBlock> blocks = new ArrayList<>();
        int n = candles.size();
        int i = 1;
        while (i < n) {
            Bias impulse = colour(candles.get(i));
            if (impulse == null) {
                i++;
                continue;
            }
            int end = i;
            while (end + 1 < n && colour(candles.get(end + 1)) == impulse) {
                end++;
            }
            int length = end - i + 1;
            Candle origin = candles.get(i - 1);
            if (length >= MIN_IMPULSE && colour(origin) == opposite(impulse)) {
                blocks.add(new OrderBlock(origin.midpoint(), impulse, i - 1, origin.high(), origin.low()));
            }
            i = end + 1;
        }
        return blocks;
    }

    private static Bias colour(Candle c) {
        if (c.isBullish()) return Bias.BULLISH;
        if (c.isBearish()) return Bias.BEARISH;
        return null;
    }

    private static Bias opposite(Bias b) {
        return b == Bias.BULLISH ? Bias.BEARISH : Bias.BULLISH;
    }

    private OrderBlockDetector() {}
}
