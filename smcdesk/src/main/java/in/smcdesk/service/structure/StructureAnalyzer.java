package in.smcdesk.service.structure;

import in.smcdesk.config.AnalysisConfig;
import in.smcdesk.domain.data.Candle;
import in.smcdesk.domain.data.CandleSeries;
import in.smcdesk.domain.error.InsufficientDataException;
import in.smcdesk.domain.structure.BosEvent;
import in.smcdesk.domain.structure.OrderBlock;
import in.smcdesk.domain.structure.PricePosition;
import in.smcdesk.domain.structure.StructureSnapshot;
import in.smcdesk.domain.structure.SwingPoint;
import in.smcdesk.domain.structure.Trend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;

/**
 * Structure Analyzer - one structural read of a candle series.
 *
 * Stateless and deterministic: the same series always yields the same
 * snapshot, and concurrent calls share nothing.
 */
public final class StructureAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(StructureAnalyzer.class);

    private final AnalysisConfig config;

    public StructureAnalyzer(AnalysisConfig config) {
        if (config == null || !config.isValid()) {
            throw new IllegalArgumentException("Invalid analysis config: " + config);
        }
        this.config = config;
    }

    public StructureAnalyzer() {
        this(AnalysisConfig.defaults());
    }

    /**
     * @throws InsufficientDataException when the series is shorter than minBars
     */
    public StructureSnapshot analyze(CandleSeries series) {
        if (series.size() < config.minBars()) {
            throw new InsufficientDataException(series.symbol(), series.size(), config.minBars());
        }

        List<Candle> candles = series.candles();
        BigDecimal price = series.lastClose();

        List<SwingPoint> swings = SwingDetector.detect(candles, config.swingWindow());
        BigDecimal atr = ATRCalculator.calculate(candles, config.atrPeriod());
        Trend trend = TrendClassifier.classify(swings);

        BigDecimal support = LevelLocator.nearestSupport(candles, swings, price);
        BigDecimal resistance = LevelLocator.nearestResistance(candles, swings, price);

        ZoneDetector.Zone zone = ZoneDetector.calculateZone(swings);
        PricePosition position = ZoneDetector.positionOf(zone, price);

        List<OrderBlock> orderBlocks = OrderBlockDetector.detect(candles);
        BosEvent lastBos = BosDetector.lastBos(candles, swings, trend);

        log.debug("[SMC STRUCTURE] {} {}: trend={} position={} swings={} atr={} support={} resistance={} obs={} bos={}",
            series.symbol(), series.timeframe().label(), trend, position, swings.size(), atr,
            support, resistance, orderBlocks.size(), lastBos);

        return new StructureSnapshot(
            trend,
            position,
            price,
            support,
            resistance,
            atr,
            swings,
            orderBlocks,
            lastBos,
            zone == null ? null : zone.high(),
            zone == null ? null : zone.low());
    }

    public AnalysisConfig getConfig() {
        return config;
    }
}
