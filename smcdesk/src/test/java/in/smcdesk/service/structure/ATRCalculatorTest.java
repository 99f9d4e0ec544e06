package in.smcdesk.service.structure;

import in.smcdesk.domain.data.Candle;
import in.smcdesk.domain.data.CandleFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static in.smcdesk.domain.data.CandleFixtures.candle;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ATR calculation.
 */
@DisplayName("ATR Calculator Tests")
public class ATRCalculatorTest {

    @Test
    @DisplayName("Empty series has zero ATR")
    public void testEmpty() {
        assertEquals(0, BigDecimal.ZERO.compareTo(ATRCalculator.calculate(List.of(), 14)));
    }

    @Test
    @DisplayName("Single candle uses its own range")
    public void testSingleCandle() {
        BigDecimal atr = ATRCalculator.calculate(List.of(candle(0, "100", "104", "99", "101")), 14);
        assertEquals(0, new BigDecimal("5").compareTo(atr));
    }

    @Test
    @DisplayName("True range includes gaps from the previous close")
    public void testTrueRangeGap() {
        Candle previous = candle(0, "9", "11", "8", "10");
        Candle gapUp = candle(1, "13", "15", "13", "14");

        assertEquals(0, new BigDecimal("5").compareTo(ATRCalculator.calculateTrueRange(gapUp, previous)));
    }

    @Test
    @DisplayName("Short series averages the available true ranges")
    public void testShortSeriesSimpleAverage() {
        List<Candle> candles = List.of(
            candle(0, "100", "101", "99", "100"),
            candle(1, "100", "102", "100", "101"),   // TR 2
            candle(2, "101", "105", "101", "104"));  // TR 4

        assertEquals(0, new BigDecimal("3").compareTo(ATRCalculator.calculate(candles, 14)));
    }

    @Test
    @DisplayName("Constant true range gives that range")
    public void testConstantRange() {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            candles.add(candle(i, "101", "102", "100", "101"));
        }

        assertEquals(0, new BigDecimal("2").compareTo(ATRCalculator.calculate(candles, 14)));
    }

    @Test
    @DisplayName("Flat series has zero ATR")
    public void testFlatSeries() {
        BigDecimal atr = ATRCalculator.calculate(CandleFixtures.flatSeries(40, "50").candles(), 14);
        assertEquals(0, atr.signum());
    }

    @Test
    @DisplayName("Wilder ATR of the uptrend fixture")
    public void testWilderOnFixture() {
        BigDecimal atr = ATRCalculator.calculate(CandleFixtures.bullishCandles(), 14);

        assertTrue(atr.signum() > 0);
        assertEquals(2.3761, atr.doubleValue(), 0.001);
    }

    @Test
    @DisplayName("Non-positive period is rejected")
    public void testInvalidPeriod() {
        assertThrows(IllegalArgumentException.class,
            () -> ATRCalculator.calculate(CandleFixtures.bullishCandles(), 0));
    }

    @Test
    @DisplayName("Sufficient data needs period + 1 candles")
    public void testHasSufficientData() {
        List<Candle> candles = CandleFixtures.bullishCandles();
        assertTrue(ATRCalculator.hasSufficientData(candles, 14));
        assertFalse(ATRCalculator.hasSufficientData(candles.subList(0, 14), 14));
        assertFalse(ATRCalculator.hasSufficientData(null, 14));
    }
}
