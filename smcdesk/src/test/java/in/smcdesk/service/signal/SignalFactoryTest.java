package in.smcdesk.service.signal;

import in.smcdesk.config.BotConfig;
import in.smcdesk.domain.data.CandleFixtures;
import in.smcdesk.domain.data.InstrumentClass;
import in.smcdesk.domain.data.Timeframe;
import in.smcdesk.domain.error.InsufficientDataException;
import in.smcdesk.domain.error.NoValidSetupException;
import in.smcdesk.domain.signal.Direction;
import in.smcdesk.domain.signal.EntryType;
import in.smcdesk.domain.signal.ManualSignalRequest;
import in.smcdesk.domain.signal.QualityTier;
import in.smcdesk.domain.signal.Signal;
import in.smcdesk.domain.signal.SignalRequest;
import in.smcdesk.domain.signal.TradingMode;
import in.smcdesk.domain.structure.Bias;
import in.smcdesk.domain.structure.BosEvent;
import in.smcdesk.domain.structure.PricePosition;
import in.smcdesk.domain.structure.StructureSnapshot;
import in.smcdesk.domain.structure.Trend;
import in.smcdesk.service.risk.RiskEngine;
import in.smcdesk.service.structure.StructureAnalyzer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Signal Factory Tests")
public class SignalFactoryTest {

    private static final Instant NOW = Instant.parse("2024-01-02T16:00:00Z");

    private SignalFactory factory;
    private SignalRequest request;

    @BeforeEach
    public void setUp() {
        factory = new SignalFactory(new StructureAnalyzer(), new RiskEngine(), Clock.fixed(NOW, ZoneOffset.UTC));
        request = new SignalRequest(CandleFixtures.SYMBOL, Timeframe.H1, InstrumentClass.CRYPTO,
            TradingMode.INTRADAY, null);
    }

    @Test
    @DisplayName("Uptrend produces a BUY signal with ordered levels")
    public void testBuySignal() {
        Signal signal = factory.create(CandleFixtures.bullishSeries(), request, BotConfig.defaults());

        assertNotNull(signal.signalId());
        assertEquals(Direction.BUY, signal.direction());
        assertEquals("smc", signal.strategy());
        assertEquals(NOW, signal.createdAt());
        assertEquals(0, new BigDecimal("130").compareTo(signal.currentPrice()));
        assertTrue(signal.stopLoss().compareTo(signal.optimalEntry()) < 0);
        assertTrue(signal.optimalEntry().compareTo(signal.takeProfit1()) < 0);
        assertTrue(signal.rrRatio().compareTo(new BigDecimal("2.0")) >= 0);
        assertEquals(Trend.BULLISH, signal.structure().trend());
        assertEquals(1, signal.takeProfits().size());
    }

    @Test
    @DisplayName("Downtrend produces a SELL signal")
    public void testSellSignal() {
        Signal signal = factory.create(CandleFixtures.bearishSeries(), request, BotConfig.defaults());

        assertEquals(Direction.SELL, signal.direction());
        assertTrue(signal.takeProfit1().compareTo(signal.optimalEntry()) < 0);
        assertTrue(signal.optimalEntry().compareTo(signal.stopLoss()) < 0);
    }

    @Test
    @DisplayName("Ten candles raise InsufficientDataException")
    public void testTenCandles() {
        assertThrows(InsufficientDataException.class,
            () -> factory.create(CandleFixtures.flatSeries(10, "100"), request, BotConfig.defaults()));
    }

    @Test
    @DisplayName("Ranging market without a break has no setup")
    public void testRangingWithoutBreak() {
        assertThrows(NoValidSetupException.class,
            () -> factory.create(CandleFixtures.flatSeries(40, "100"), request, BotConfig.defaults()));
    }

    @Test
    @DisplayName("Ranging direction follows the last break of structure")
    public void testResolveDirection() {
        assertEquals(Direction.BUY, SignalFactory.resolveDirection(structure(Trend.BULLISH, null)));
        assertEquals(Direction.SELL, SignalFactory.resolveDirection(structure(Trend.BEARISH, null)));
        assertEquals(Direction.NEUTRAL, SignalFactory.resolveDirection(structure(Trend.RANGING, null)));
        assertEquals(Direction.SELL, SignalFactory.resolveDirection(structure(Trend.RANGING,
            new BosEvent(new BigDecimal("95"), Bias.BEARISH, 20))));
        assertEquals(Direction.BUY, SignalFactory.resolveDirection(structure(Trend.RANGING,
            new BosEvent(new BigDecimal("105"), Bias.BULLISH, 20))));
    }

    @Test
    @DisplayName("Signal ids are unique")
    public void testUniqueIds() {
        Signal a = factory.create(CandleFixtures.bullishSeries(), request, BotConfig.defaults());
        Signal b = factory.create(CandleFixtures.bullishSeries(), request, BotConfig.defaults());
        assertNotEquals(a.signalId(), b.signalId());
    }

    @Test
    @DisplayName("Hand-entered signal keeps its levels and derives RR and tier")
    public void testFromManual() {
        ManualSignalRequest manual = new ManualSignalRequest("ETH/USD", Direction.SELL, InstrumentClass.CRYPTO,
            Timeframe.H4, TradingMode.SWING, "breakout", new BigDecimal("2000"), new BigDecimal("2100"),
            new BigDecimal("1750"), new BigDecimal("1600"), null, 82);

        Signal signal = factory.fromManual(manual);

        assertEquals(Direction.SELL, signal.direction());
        assertEquals(EntryType.MARKET, signal.entryType());
        assertEquals(0, new BigDecimal("2000").compareTo(signal.optimalEntry()));
        assertEquals(0, new BigDecimal("2000").compareTo(signal.currentPrice()));
        assertEquals(0, new BigDecimal("2.5000").compareTo(signal.rrRatio()));
        assertEquals(QualityTier.A, signal.qualityTier());
        assertEquals(List.of(new BigDecimal("1750"), new BigDecimal("1600")), signal.takeProfits());
        assertEquals(Timeframe.H4, signal.timeframe());
        assertEquals("breakout", signal.strategy());
        assertNull(signal.structure());
        assertEquals(NOW, signal.createdAt());
    }

    private static StructureSnapshot structure(Trend trend, BosEvent bos) {
        BigDecimal price = new BigDecimal("100");
        return new StructureSnapshot(trend, PricePosition.EQUILIBRIUM, price, null, null, BigDecimal.ONE,
            List.of(), List.of(), bos, null, null);
    }
}
