package in.smcdesk.service.risk;

import in.smcdesk.config.BotConfig;
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
import in.smcdesk.domain.structure.SwingPoint;
import in.smcdesk.service.structure.ZoneDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Risk Engine - entry, stop and targets for a direction.
 *
 * Entry:
 * - LIMIT when BUY sits in DISCOUNT or inside a BULLISH order block (SELL:
 *   PREMIUM or a BEARISH block). Limit price is the block's mean threshold,
 *   else the 23.6% retracement of the swing range, provided it lies on the
 *   favourable side of price. Otherwise MARKET at current price.
 *
 * Stop:
 * - BUY: min(support − 0.1 ATR, entry − ATR × mode multiplier)
 * - SELL: max(resistance + 0.1 ATR, entry + ATR × mode multiplier)
 *
 * Stop distance is measured from the entry, so a LIMIT order keeps its
 * ATR distance from the limit price rather than from the current price.
 *
 * Targets:
 * - Candidates are swing levels beyond both entry and current price,
 *   starting at the nearest unbroken resistance (BUY) or support (SELL).
 *   Levels the market has already traded through are never targets.
 * - TP1 is the nearest candidate whose RR reaches the floor; if none
 *   does, TP1 is placed at exactly floor × risk from entry.
 * - TP2 / TP3 are the next structural levels beyond TP1, null when none exist.
 */
public final class RiskEngine {
    private static final Logger log = LoggerFactory.getLogger(RiskEngine.class);

    static final BigDecimal STOP_BUFFER_ATR = new BigDecimal("0.1");
    public static final int RR_SCALE = 4;

    public TradeLevels computeLevels(StructureSnapshot structure, BigDecimal currentPrice,
                                     Direction direction, TradingMode mode, BotConfig config) {
        return computeLevels("-", structure, currentPrice, direction, mode, config);
    }

    public TradeLevels computeLevels(String symbol, StructureSnapshot structure, BigDecimal currentPrice,
                                     Direction direction, TradingMode mode, BotConfig config) {
        if (direction == null || !direction.isTradable()) {
            throw new NoValidSetupException(symbol, "no directional bias");
        }
        boolean buy = direction == Direction.BUY;

        BigDecimal anchor = buy ? structure.nearestSupport() : structure.nearestResistance();
        if (anchor == null) {
            throw new NoValidSetupException(symbol, buy
                ? "no unbroken support below price"
                : "no unbroken resistance above price");
        }

        // Entry
        BigDecimal limit = findLimitEntry(structure, currentPrice, buy);
        EntryType entryType = limit != null ? EntryType.LIMIT : EntryType.MARKET;
        BigDecimal entry = limit != null ? limit : currentPrice;

        // Stop
        BigDecimal atr = structure.atr();
        BigDecimal distance = atr.multiply(mode.stopMultiplier());
        BigDecimal buffer = atr.multiply(STOP_BUFFER_ATR);
        BigDecimal stopLoss = buy
            ? anchor.subtract(buffer).min(entry.subtract(distance))
            : anchor.add(buffer).max(entry.add(distance));

        BigDecimal risk = entry.subtract(stopLoss).abs();
        boolean stopOnCorrectSide = buy ? stopLoss.compareTo(entry) < 0 : stopLoss.compareTo(entry) > 0;
        if (risk.signum() == 0 || !stopOnCorrectSide) {
            throw new NoValidSetupException(symbol, "degenerate stop distance (entry=" + entry
                + ", stop=" + stopLoss + ")");
        }

        // Targets
        BigDecimal floor = config.minRiskReward();
        BigDecimal nearestTarget = buy ? structure.nearestResistance() : structure.nearestSupport();
        BigDecimal from = buy ? entry.max(currentPrice) : entry.min(currentPrice);
        List<BigDecimal> candidates = targetCandidates(structure.swingPoints(), from, nearestTarget, buy);
        BigDecimal minReward = risk.multiply(floor);

        int tp1Index = -1;
        for (int i = 0; i < candidates.size(); i++) {
            if (candidates.get(i).subtract(entry).abs().compareTo(minReward) >= 0) {
                tp1Index = i;
                break;
            }
        }

        BigDecimal tp1;
        List<BigDecimal> beyond;
        if (tp1Index >= 0) {
            tp1 = candidates.get(tp1Index);
            beyond = candidates.subList(tp1Index + 1, candidates.size());
        } else {
            tp1 = buy ? entry.add(minReward) : entry.subtract(minReward);
            final BigDecimal scaled = tp1;
            beyond = candidates.stream()
                .filter(c -> buy ? c.compareTo(scaled) > 0 : c.compareTo(scaled) < 0)
                .toList();
        }
        BigDecimal tp2 = beyond.size() > 0 ? beyond.get(0) : null;
        BigDecimal tp3 = beyond.size() > 1 ? beyond.get(1) : null;

        BigDecimal rr = tp1.subtract(entry).abs().divide(risk, RR_SCALE, RoundingMode.HALF_UP);
        if (rr.signum() <= 0) {
            throw new NoValidSetupException(symbol, "non-positive risk-reward");
        }

        double confidence = ConfidenceScorer.score(structure.trend(), structure.pricePosition(), direction, rr);
        QualityTier tier = QualityTier.of(confidence);

        log.debug("[SMC RISK] Levels {} {} {}: entry={} ({}) sl={} tp1={} tp2={} tp3={} rr={} conf={} tier={}",
            symbol, direction, mode, entry, entryType, stopLoss, tp1, tp2, tp3, rr, confidence, tier);

        return new TradeLevels(direction, entry, entryType, stopLoss, tp1, tp2, tp3, rr, confidence, tier);
    }

    /**
     * Limit entry price, or null for a market entry.
     */
    static BigDecimal findLimitEntry(StructureSnapshot structure, BigDecimal price, boolean buy) {
        PricePosition favouredZone = buy ? PricePosition.DISCOUNT : PricePosition.PREMIUM;
        OrderBlock block = containingBlock(structure.orderBlocks(), price, buy ? Bias.BULLISH : Bias.BEARISH);

        if (structure.pricePosition() != favouredZone && block == null) {
            return null;
        }
        if (block != null && isFavourable(block.entryZone(), price, buy)) {
            return block.entryZone();
        }
        if (structure.hasRange()) {
            ZoneDetector.Zone zone = ZoneDetector.calculateZoneFromRange(structure.rangeHigh(), structure.rangeLow());
            BigDecimal level = buy
                ? zone.levelFromLow(ZoneDetector.RETRACEMENT_LEVEL)
                : zone.levelFromHigh(ZoneDetector.RETRACEMENT_LEVEL);
            if (isFavourable(level, price, buy)) {
                return level;
            }
        }
        return null;
    }

    /**
     * Most recent block of the given bias whose range contains price.
     */
    static OrderBlock containingBlock(List<OrderBlock> blocks, BigDecimal price, Bias bias) {
        for (int i = blocks.size() - 1; i >= 0; i--) {
            OrderBlock ob = blocks.get(i);
            if (ob.direction() == bias && ob.contains(price)) {
                return ob;
            }
        }
        return null;
    }

    private static boolean isFavourable(BigDecimal level, BigDecimal price, boolean buy) {
        return buy ? level.compareTo(price) < 0 : level.compareTo(price) > 0;
    }

    /**
     * Distinct swing prices strictly beyond {@code from} and at or beyond the
     * nearest unbroken level, nearest first. Empty when there is no unbroken
     * level on the target side.
     */
    static List<BigDecimal> targetCandidates(List<SwingPoint> swings, BigDecimal from,
                                             BigDecimal nearestLevel, boolean buy) {
        List<BigDecimal> result = new ArrayList<>();
        if (nearestLevel == null) {
            return result;
        }
        Comparator<BigDecimal> nearestFirst = buy ? Comparator.naturalOrder() : Comparator.reverseOrder();
        swings.stream()
            .filter(s -> buy ? s.isHigh() : s.isLow())
            .map(SwingPoint::price)
            .filter(p -> buy ? p.compareTo(from) > 0 : p.compareTo(from) < 0)
            .filter(p -> buy ? p.compareTo(nearestLevel) >= 0 : p.compareTo(nearestLevel) <= 0)
            .sorted(nearestFirst)
            .forEach(p -> {
                if (result.isEmpty() || result.get(result.size() - 1).compareTo(p) != 0) {
                    result.add(p);
                }
            });
        return result;
    }
}
