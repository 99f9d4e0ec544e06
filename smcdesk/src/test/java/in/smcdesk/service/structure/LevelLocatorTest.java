package in.smcdesk.service.structure;

import in.smcdesk.domain.data.Candle;
import in.smcdesk.domain.data.CandleFixtures;
import in.smcdesk.domain.structure.SwingKind;
import in.smcdesk.domain.structure.SwingPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static in.smcdesk.domain.data.CandleFixtures.candle;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Level Locator Tests")
public class LevelLocatorTest {

    @Test
    @DisplayName("Support is the unbroken swing low below price")
    public void testSupportOnFixture() {
        List<Candle> candles = CandleFixtures.bullishCandles();
        List<SwingPoint> swings = SwingDetector.detect(candles, 2);

        BigDecimal support = LevelLocator.nearestSupport(candles, swings, new BigDecimal("130"));

        assertEquals(0, new BigDecimal("100").compareTo(support));
    }

    @Test
    @DisplayName("Swing highs closed above are not resistance")
    public void testBrokenResistance() {
        List<Candle> candles = CandleFixtures.bullishCandles();
        List<SwingPoint> swings = SwingDetector.detect(candles, 2);

        assertNull(LevelLocator.nearestResistance(candles, swings, new BigDecimal("130")));
    }

    @Test
    @DisplayName("Nearest of several unbroken levels wins")
    public void testNearestLevel() {
        List<Candle> candles = List.of(
            candle(0, "100", "101", "99", "100"),
            candle(1, "100", "101", "99", "100"),
            candle(2, "100", "101", "99", "100"),
            candle(3, "100", "101", "99", "100"));
        List<SwingPoint> swings = List.of(
            new SwingPoint(0, new BigDecimal("95"), SwingKind.LOW),
            new SwingPoint(1, new BigDecimal("98"), SwingKind.LOW),
            new SwingPoint(1, new BigDecimal("110"), SwingKind.HIGH),
            new SwingPoint(2, new BigDecimal("105"), SwingKind.HIGH));

        BigDecimal price = new BigDecimal("100");
        assertEquals(0, new BigDecimal("98").compareTo(LevelLocator.nearestSupport(candles, swings, price)));
        assertEquals(0, new BigDecimal("105").compareTo(LevelLocator.nearestResistance(candles, swings, price)));
    }

    @Test
    @DisplayName("A later close through a swing low breaks it")
    public void testBrokenSupport() {
        List<Candle> candles = List.of(
            candle(0, "100", "101", "97", "100"),
            candle(1, "100", "101", "96", "97"),
            candle(2, "97", "101", "96", "100"));
        SwingPoint low = new SwingPoint(0, new BigDecimal("98"), SwingKind.LOW);

        assertTrue(LevelLocator.isBroken(candles, low));
        assertNull(LevelLocator.nearestSupport(candles, List.of(low), new BigDecimal("100")));
    }
}
