package in.smcdesk.domain.signal;

import in.smcdesk.domain.data.InstrumentClass;
import in.smcdesk.domain.data.Timeframe;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Manual Signal Request Tests")
public class ManualSignalRequestTest {

    @Test
    @DisplayName("Ordered BUY levels are accepted and defaults applied")
    public void testBuyDefaults() {
        ManualSignalRequest request = buy("95", "100", "110", "120", "130");

        assertEquals(Timeframe.H1, request.timeframe());
        assertEquals(TradingMode.INTRADAY, request.mode());
        assertEquals("manual", request.strategy());
    }

    @Test
    @DisplayName("Ordered SELL levels are accepted")
    public void testSellOrdering() {
        assertDoesNotThrow(() -> request(Direction.SELL, "105", "100", "90", "80", null, 50));
    }

    @Test
    @DisplayName("BUY stop at or above entry is rejected")
    public void testBuyStopAboveEntry() {
        assertThrows(IllegalArgumentException.class, () -> buy("100", "100", "110", null, null));
        assertThrows(IllegalArgumentException.class, () -> buy("101", "100", "110", null, null));
    }

    @Test
    @DisplayName("Targets must move away from entry in order")
    public void testTargetOrdering() {
        assertThrows(IllegalArgumentException.class, () -> buy("95", "100", "99", null, null));
        assertThrows(IllegalArgumentException.class, () -> buy("95", "100", "110", "105", null));
        assertThrows(IllegalArgumentException.class, () -> buy("95", "100", "110", "120", "120"));
        assertThrows(IllegalArgumentException.class,
            () -> request(Direction.SELL, "105", "100", "90", "95", null, 50));
    }

    @Test
    @DisplayName("Third target without a second is rejected")
    public void testGapInTargets() {
        assertThrows(IllegalArgumentException.class, () -> buy("95", "100", "110", null, "130"));
    }

    @Test
    @DisplayName("Neutral direction, missing prices and bad confidence are rejected")
    public void testInvalidFields() {
        assertThrows(IllegalArgumentException.class,
            () -> request(Direction.NEUTRAL, "95", "100", "110", null, null, 50));
        assertThrows(IllegalArgumentException.class,
            () -> request(Direction.BUY, "95", null, "110", null, null, 50));
        assertThrows(IllegalArgumentException.class,
            () -> request(Direction.BUY, "95", "100", "110", null, null, 101));
        assertThrows(IllegalArgumentException.class,
            () -> request(Direction.BUY, "95", "100", "110", null, null, -1));
    }

    private static ManualSignalRequest buy(String sl, String entry, String tp1, String tp2, String tp3) {
        return request(Direction.BUY, sl, entry, tp1, tp2, tp3, 70);
    }

    private static ManualSignalRequest request(Direction direction, String sl, String entry, String tp1,
                                               String tp2, String tp3, double confidence) {
        return new ManualSignalRequest("BTC/USD", direction, InstrumentClass.CRYPTO, null, null, null,
            dec(entry), dec(sl), dec(tp1), dec(tp2), dec(tp3), confidence);
    }

    private static BigDecimal dec(String value) {
        return value == null ? null : new BigDecimal(value);
    }
}
