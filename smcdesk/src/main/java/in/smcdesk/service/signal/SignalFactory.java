package in.smcdesk.service.signal;

import in.smcdesk.config.BotConfig;
import in.smcdesk.domain.data.CandleSeries;
import in.smcdesk.domain.error.NoValidSetupException;
import in.smcdesk.domain.signal.Direction;
import in.smcdesk.domain.signal.EntryType;
import in.smcdesk.domain.signal.ManualSignalRequest;
import in.smcdesk.domain.signal.QualityTier;
import in.smcdesk.domain.signal.Signal;
import in.smcdesk.domain.signal.SignalRequest;
import in.smcdesk.domain.signal.TradeLevels;
import in.smcdesk.domain.structure.Bias;
import in.smcdesk.domain.structure.StructureSnapshot;
import in.smcdesk.service.risk.RiskEngine;
import in.smcdesk.service.structure.StructureAnalyzer;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.UUID;

/**
 * Signal Factory - structure analysis plus risk levels into one immutable Signal.
 *
 * Direction: BULLISH → BUY, BEARISH → SELL, RANGING → direction of the last
 * break of structure; no break means NEUTRAL and no signal.
 *
 * Hand-entered signals carry no structure snapshot and enter at market at
 * their stated entry price.
 */
public final class SignalFactory {

    private final StructureAnalyzer analyzer;
    private final RiskEngine riskEngine;
    private final Clock clock;

    public SignalFactory(StructureAnalyzer analyzer, RiskEngine riskEngine, Clock clock) {
        this.analyzer = analyzer;
        this.riskEngine = riskEngine;
        this.clock = clock;
    }

    /**
     * @throws in.smcdesk.domain.error.InsufficientDataException when the series is too short
     * @throws NoValidSetupException when no direction or no valid levels exist
     */
    public Signal create(CandleSeries series, SignalRequest request, BotConfig config) {
        StructureSnapshot structure = analyzer.analyze(series);

        Direction direction = resolveDirection(structure);
        if (!direction.isTradable()) {
            throw new NoValidSetupException(request.symbol(), "ranging market without a break of structure");
        }

        TradeLevels levels = riskEngine.computeLevels(request.symbol(), structure, structure.currentPrice(),
            direction, request.mode(), config);

        return new Signal(
            UUID.randomUUID().toString(),
            request.symbol(),
            request.timeframe(),
            request.instrumentClass(),
            request.mode(),
            request.strategy(),
            direction,
            structure.currentPrice(),
            levels.optimalEntry(),
            levels.entryType(),
            levels.stopLoss(),
            levels.takeProfit1(),
            levels.takeProfit2(),
            levels.takeProfit3(),
            levels.rrRatio(),
            levels.confidence(),
            levels.qualityTier(),
            structure,
            clock.instant());
    }

    public Signal fromManual(ManualSignalRequest request) {
        BigDecimal risk = request.entryPrice().subtract(request.stopLoss()).abs();
        BigDecimal rr = request.takeProfit1().subtract(request.entryPrice()).abs()
            .divide(risk, RiskEngine.RR_SCALE, RoundingMode.HALF_UP);

        return new Signal(
            UUID.randomUUID().toString(),
            request.symbol(),
            request.timeframe(),
            request.instrumentClass(),
            request.mode(),
            request.strategy(),
            request.direction(),
            request.entryPrice(),
            request.entryPrice(),
            EntryType.MARKET,
            request.stopLoss(),
            request.takeProfit1(),
            request.takeProfit2(),
            request.takeProfit3(),
            rr,
            request.confidence(),
            QualityTier.of(request.confidence()),
            null,
            clock.instant());
    }

    static Direction resolveDirection(StructureSnapshot structure) {
        return switch (structure.trend()) {
            case BULLISH -> Direction.BUY;
            case BEARISH -> Direction.SELL;
            case RANGING -> {
                if (structure.lastBos() == null) {
                    yield Direction.NEUTRAL;
                }
                yield structure.lastBos().direction() == Bias.BULLISH ? Direction.BUY : Direction.SELL;
            }
        };
    }
}
