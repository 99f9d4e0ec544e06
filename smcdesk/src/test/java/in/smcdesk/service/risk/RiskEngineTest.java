package in.smcdesk.service.risk;

import in.smcdesk.config.BotConfig;
import in.smcdesk.domain.data.CandleFixtures;
import in.smcdesk.domain.error.NoValidSetupException;
import in.smcdesk.domain.signal.Direction;
import in.smcdesk.domain.signal.EntryType;
import in.smcdesk.domain.signal.QualityTier;
import in.smcdesk.domain.signal.TradeLevels;
import in.smcdesk.domain.signal.TradingMode;
import in.smcdesk.domain.structure.Bias;
import in.smcdesk.domain.structure.OrderBlock;
import in.smcdesk.domain.structure.PricePosition;
import in.smcdesk.domain.structure.StructureSnapshot;
import in.smcdesk.domain.structure.SwingKind;
import in.smcdesk.domain.structure.SwingPoint;
import in.smcdesk.domain.structure.Trend;
import in.smcdesk.service.structure.StructureAnalyzer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Risk Engine Tests")
public class RiskEngineTest {

    private RiskEngine engine;
    private BotConfig config;

    @BeforeEach
    public void setUp() {
        engine = new RiskEngine();
        config = BotConfig.defaults();
    }

    @Test
    @DisplayName("Uptrend BUY: stop below support, target beyond price, RR at the floor")
    public void testUptrendBuy() {
        StructureSnapshot structure = new StructureAnalyzer().analyze(CandleFixtures.bullishSeries());

        TradeLevels levels = engine.computeLevels(structure, structure.currentPrice(),
            Direction.BUY, TradingMode.INTRADAY, config);

        assertEquals(EntryType.MARKET, levels.entryType());
        assertEquals(0, new BigDecimal("130").compareTo(levels.optimalEntry()));
        BigDecimal bufferedSupport = new BigDecimal("100").subtract(structure.atr().multiply(new BigDecimal("0.1")));
        assertTrue(levels.stopLoss().compareTo(bufferedSupport) <= 0);
        assertTrue(levels.stopLoss().compareTo(levels.optimalEntry()) < 0);
        assertTrue(levels.takeProfit1().compareTo(new BigDecimal("130")) > 0);
        assertTrue(levels.rrRatio().compareTo(config.minRiskReward()) >= 0);
        assertNull(levels.takeProfit2());
        assertNull(levels.takeProfit3());
        assertEquals(61.0, levels.confidence(), 0.001);
        assertEquals(QualityTier.C, levels.qualityTier());
    }

    @Test
    @DisplayName("Downtrend SELL mirrors the uptrend")
    public void testDowntrendSell() {
        StructureSnapshot structure = new StructureAnalyzer().analyze(CandleFixtures.bearishSeries());

        TradeLevels levels = engine.computeLevels(structure, structure.currentPrice(),
            Direction.SELL, TradingMode.INTRADAY, config);

        assertTrue(levels.stopLoss().compareTo(new BigDecimal("130")) > 0);
        assertTrue(levels.takeProfit1().compareTo(levels.optimalEntry()) < 0);
        assertTrue(levels.optimalEntry().compareTo(levels.stopLoss()) < 0);
        assertTrue(levels.rrRatio().compareTo(config.minRiskReward()) >= 0);
    }

    @Test
    @DisplayName("TP1 is the nearest swing high that meets the floor; TP2 and TP3 follow")
    public void testStructuralTargets() {
        StructureSnapshot structure = snapshot(Trend.BULLISH, PricePosition.EQUILIBRIUM, "100", "95", "104", "2",
            List.of(high(3, "104"), high(6, "115"), high(9, "120"), high(12, "130"), low(14, "95")),
            List.of(), null, null);

        TradeLevels levels = engine.computeLevels(structure, new BigDecimal("100"),
            Direction.BUY, TradingMode.INTRADAY, config);

        assertEquals(0, new BigDecimal("94.8").compareTo(levels.stopLoss()));
        assertEquals(0, new BigDecimal("115").compareTo(levels.takeProfit1()));
        assertEquals(0, new BigDecimal("120").compareTo(levels.takeProfit2()));
        assertEquals(0, new BigDecimal("130").compareTo(levels.takeProfit3()));
        assertEquals(0, new BigDecimal("2.8846").compareTo(levels.rrRatio()));
        assertEquals(QualityTier.B, levels.qualityTier());
    }

    @Test
    @DisplayName("RR equals reward over risk")
    public void testRiskRewardConsistency() {
        StructureSnapshot structure = snapshot(Trend.BULLISH, PricePosition.EQUILIBRIUM, "100", "95", "104", "2",
            List.of(high(3, "104"), high(6, "115"), low(14, "95")), List.of(), null, null);

        TradeLevels levels = engine.computeLevels(structure, new BigDecimal("100"),
            Direction.BUY, TradingMode.INTRADAY, config);

        BigDecimal expected = levels.reward().divide(levels.risk(), 4, RoundingMode.HALF_UP);
        assertEquals(0, expected.compareTo(levels.rrRatio()));
    }

    @Test
    @DisplayName("Higher RR floor pushes the scaled target further")
    public void testFloorScalesTarget() {
        StructureSnapshot structure = snapshot(Trend.BULLISH, PricePosition.EQUILIBRIUM, "100", "95", null, "2",
            List.of(low(14, "95")), List.of(), null, null);
        BotConfig strict = new BotConfig(false, new BigDecimal("0.02"), 10, List.of(), List.of("smc"),
            false, new BigDecimal("3"), true);

        TradeLevels normal = engine.computeLevels(structure, new BigDecimal("100"),
            Direction.BUY, TradingMode.INTRADAY, config);
        TradeLevels far = engine.computeLevels(structure, new BigDecimal("100"),
            Direction.BUY, TradingMode.INTRADAY, strict);

        assertEquals(0, new BigDecimal("110.4").compareTo(normal.takeProfit1()));
        assertEquals(0, new BigDecimal("115.6").compareTo(far.takeProfit1()));
        assertEquals(0, new BigDecimal("3.0000").compareTo(far.rrRatio()));
    }

    @Test
    @DisplayName("Longer horizons place wider stops")
    public void testModeMultiplier() {
        StructureSnapshot structure = snapshot(Trend.BULLISH, PricePosition.EQUILIBRIUM, "100", "99", null, "4",
            List.of(low(14, "99")), List.of(), null, null);

        BigDecimal scalp = engine.computeLevels(structure, new BigDecimal("100"),
            Direction.BUY, TradingMode.SCALPING, config).stopLoss();
        BigDecimal swing = engine.computeLevels(structure, new BigDecimal("100"),
            Direction.BUY, TradingMode.SWING, config).stopLoss();

        assertEquals(0, new BigDecimal("98").compareTo(scalp));
        assertEquals(0, new BigDecimal("94").compareTo(swing));
    }

    @Test
    @DisplayName("Price inside a bullish order block enters at its mean threshold")
    public void testOrderBlockLimitEntry() {
        OrderBlock block = new OrderBlock(new BigDecimal("102"), Bias.BULLISH, 5,
            new BigDecimal("104"), new BigDecimal("100"));
        StructureSnapshot structure = snapshot(Trend.BULLISH, PricePosition.EQUILIBRIUM, "103", "95", null, "2",
            List.of(low(14, "95")), List.of(block), null, null);

        TradeLevels levels = engine.computeLevels(structure, new BigDecimal("103"),
            Direction.BUY, TradingMode.INTRADAY, config);

        assertEquals(EntryType.LIMIT, levels.entryType());
        assertEquals(0, new BigDecimal("102").compareTo(levels.optimalEntry()));
    }

    @Test
    @DisplayName("Discount BUY enters at the 23.6% retracement when it is below price")
    public void testRetracementLimitEntry() {
        StructureSnapshot structure = snapshot(Trend.BULLISH, PricePosition.DISCOUNT, "130", "110", null, "2",
            List.of(low(14, "110")), List.of(), "200", "100");

        TradeLevels levels = engine.computeLevels(structure, new BigDecimal("130"),
            Direction.BUY, TradingMode.INTRADAY, config);

        assertEquals(EntryType.LIMIT, levels.entryType());
        assertEquals(0, new BigDecimal("123.6").compareTo(levels.optimalEntry()));
        assertEquals(0, new BigDecimal("109.8").compareTo(levels.stopLoss()));
    }

    @Test
    @DisplayName("Retracement above price falls back to a market entry")
    public void testUnfavourableRetracement() {
        StructureSnapshot structure = snapshot(Trend.BULLISH, PricePosition.DISCOUNT, "110", "105", null, "2",
            List.of(low(14, "105")), List.of(), "200", "100");

        TradeLevels levels = engine.computeLevels(structure, new BigDecimal("110"),
            Direction.BUY, TradingMode.INTRADAY, config);

        assertEquals(EntryType.MARKET, levels.entryType());
        assertEquals(0, new BigDecimal("110").compareTo(levels.optimalEntry()));
    }

    @Test
    @DisplayName("BUY without support has no valid setup")
    public void testMissingAnchor() {
        StructureSnapshot structure = snapshot(Trend.BULLISH, PricePosition.EQUILIBRIUM, "100", null, "110", "2",
            List.of(), List.of(), null, null);

        NoValidSetupException e = assertThrows(NoValidSetupException.class,
            () -> engine.computeLevels(structure, new BigDecimal("100"), Direction.BUY, TradingMode.INTRADAY, config));
        assertEquals("NO_VALID_SETUP", e.getErrorCode());
    }

    @Test
    @DisplayName("Neutral direction has no valid setup")
    public void testNeutral() {
        StructureSnapshot structure = snapshot(Trend.RANGING, PricePosition.EQUILIBRIUM, "100", "95", "105", "2",
            List.of(), List.of(), null, null);

        assertThrows(NoValidSetupException.class,
            () -> engine.computeLevels(structure, new BigDecimal("100"), Direction.NEUTRAL, TradingMode.INTRADAY, config));
    }

    @Test
    @DisplayName("Target candidates are distinct and nearest first")
    public void testTargetCandidates() {
        List<SwingPoint> swings = List.of(low(1, "90"), high(2, "120"), low(3, "80"), high(4, "110"),
            low(5, "85"), high(6, "110"));

        assertEquals(List.of(new BigDecimal("110"), new BigDecimal("120")),
            RiskEngine.targetCandidates(swings, new BigDecimal("100"), new BigDecimal("110"), true));
        assertEquals(List.of(new BigDecimal("90"), new BigDecimal("85"), new BigDecimal("80")),
            RiskEngine.targetCandidates(swings, new BigDecimal("100"), new BigDecimal("90"), false));
    }

    @Test
    @DisplayName("Target candidates start at the nearest unbroken level")
    public void testTargetCandidatesFromNearestLevel() {
        List<SwingPoint> swings = List.of(high(2, "109"), low(3, "80"), high(4, "125"), high(6, "140"));

        assertEquals(List.of(new BigDecimal("125"), new BigDecimal("140")),
            RiskEngine.targetCandidates(swings, new BigDecimal("106"), new BigDecimal("125"), true));
        assertTrue(RiskEngine.targetCandidates(swings, new BigDecimal("106"), null, true).isEmpty());
        assertTrue(RiskEngine.targetCandidates(swings, new BigDecimal("100"), null, false).isEmpty());
    }

    @Test
    @DisplayName("Limit BUY never targets a swing high the price has already passed")
    public void testLimitEntrySkipsPassedHigh() {
        OrderBlock block = new OrderBlock(new BigDecimal("106"), Bias.BULLISH, 3,
            new BigDecimal("111"), new BigDecimal("101"));
        StructureSnapshot structure = snapshot(Trend.BULLISH, PricePosition.EQUILIBRIUM, "110", "105", "125", "1",
            List.of(low(1, "105"), high(5, "109"), low(7, "105.5"), high(9, "125")), List.of(block), null, null);

        TradeLevels levels = engine.computeLevels(structure, new BigDecimal("110"),
            Direction.BUY, TradingMode.INTRADAY, config);

        assertEquals(EntryType.LIMIT, levels.entryType());
        assertEquals(0, new BigDecimal("106").compareTo(levels.optimalEntry()));
        assertEquals(0, new BigDecimal("104.9").compareTo(levels.stopLoss()));
        assertEquals(0, new BigDecimal("125").compareTo(levels.takeProfit1()));
        assertTrue(levels.takeProfit1().compareTo(structure.currentPrice()) > 0);
        assertNull(levels.takeProfit2());
        assertEquals(0, new BigDecimal("17.2727").compareTo(levels.rrRatio()));
    }

    @Test
    @DisplayName("Without unbroken resistance the target is scaled to the floor")
    public void testNoResistanceScalesTarget() {
        StructureSnapshot structure = snapshot(Trend.BULLISH, PricePosition.EQUILIBRIUM, "100", "95", null, "2",
            List.of(high(3, "98"), low(14, "95")), List.of(), null, null);

        TradeLevels levels = engine.computeLevels(structure, new BigDecimal("100"),
            Direction.BUY, TradingMode.INTRADAY, config);

        assertEquals(0, new BigDecimal("110.4").compareTo(levels.takeProfit1()));
        assertNull(levels.takeProfit2());
    }

    static StructureSnapshot snapshot(Trend trend, PricePosition position, String price, String support,
                                      String resistance, String atr, List<SwingPoint> swings,
                                      List<OrderBlock> blocks, String rangeHigh, String rangeLow) {
        return new StructureSnapshot(trend, position, new BigDecimal(price), dec(support), dec(resistance),
            new BigDecimal(atr), swings, blocks, null, dec(rangeHigh), dec(rangeLow));
    }

    private static BigDecimal dec(String value) {
        return value == null ? null : new BigDecimal(value);
    }

    private static SwingPoint high(int index, String price) {
        return new SwingPoint(index, new BigDecimal(price), SwingKind.HIGH);
    }

    private static SwingPoint low(int index, String price) {
        return new SwingPoint(index, new BigDecimal(price), SwingKind.LOW);
    }
}
