package in.smcdesk.service.signal;

import in.smcdesk.application.port.input.TradeManagementService;
import in.smcdesk.application.port.output.CandleProvider;
import in.smcdesk.config.BotConfig;
import in.smcdesk.domain.data.CandleSeries;
import in.smcdesk.domain.error.DeskException;
import in.smcdesk.domain.error.SignalNotFoundException;
import in.smcdesk.domain.signal.ManualSignalRequest;
import in.smcdesk.domain.signal.Signal;
import in.smcdesk.domain.signal.SignalRequest;
import in.smcdesk.domain.trade.Trade;
import in.smcdesk.infrastructure.metrics.DeskMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Signal generation, listing and confirmation.
 *
 * When the bot is enabled with autoExecute, a generated signal whose market
 * and strategy the bot allows is opened immediately. A failed auto-execution
 * is logged and does not fail the generation. Signals entered by hand are
 * stored as given and never auto-executed.
 */
public final class SignalService {
    private static final Logger log = LoggerFactory.getLogger(SignalService.class);

    private final CandleProvider candles;
    private final SignalFactory factory;
    private final SignalStore store;
    private final TradeManagementService trades;
    private final Supplier<BotConfig> configSupplier;
    private final DeskMetrics metrics;

    public SignalService(CandleProvider candles, SignalFactory factory, SignalStore store,
                         TradeManagementService trades, Supplier<BotConfig> configSupplier,
                         DeskMetrics metrics) {
        this.candles = candles;
        this.factory = factory;
        this.store = store;
        this.trades = trades;
        this.configSupplier = configSupplier;
        this.metrics = metrics;
    }

    public Signal generate(SignalRequest request) {
        BotConfig config = configSupplier.get();
        CandleSeries series = candles.getCandles(request.symbol(), request.timeframe());

        Signal signal;
        try {
            signal = factory.create(series, request, config);
        } catch (DeskException e) {
            metrics.recordSignalRejected(e.getErrorCode());
            log.info("[SMC SIGNAL] Rejected: symbol={} tf={} code={} msg={}",
                request.symbol(), request.timeframe().label(), e.getErrorCode(), e.getMessage());
            throw e;
        }

        store.save(signal);
        metrics.recordSignalGenerated(signal.direction().name(), signal.qualityTier().name());
        log.info("[SMC SIGNAL] Generated: id={} symbol={} dir={} entry={} ({}) sl={} tp1={} rr={} conf={} tier={}",
            signal.signalId(), signal.symbol(), signal.direction(),
            signal.instrumentClass().format(signal.optimalEntry()), signal.entryType(),
            signal.instrumentClass().format(signal.stopLoss()),
            signal.instrumentClass().format(signal.takeProfit1()),
            signal.rrRatio(), signal.confidence(), signal.qualityTier());

        if (shouldAutoExecute(config, signal)) {
            try {
                Trade trade = trades.open(signal, null);
                log.info("[SMC SIGNAL] {} auto-executed as trade {}", signal.signalId(), trade.tradeId());
            } catch (DeskException | IllegalArgumentException e) {
                log.warn("[SMC SIGNAL] Auto-execution of {} failed: {}", signal.signalId(), e.getMessage());
            }
        }
        return signal;
    }

    public Signal create(ManualSignalRequest request) {
        Signal signal = factory.fromManual(request);
        store.save(signal);
        metrics.recordSignalGenerated(signal.direction().name(), signal.qualityTier().name());
        log.info("[SMC SIGNAL] Manual signal created: id={} symbol={} dir={} entry={} sl={} tp1={} rr={} conf={}",
            signal.signalId(), signal.symbol(), signal.direction(),
            signal.instrumentClass().format(signal.optimalEntry()),
            signal.instrumentClass().format(signal.stopLoss()),
            signal.instrumentClass().format(signal.takeProfit1()),
            signal.rrRatio(), signal.confidence());
        return signal;
    }

    static boolean shouldAutoExecute(BotConfig config, Signal signal) {
        return config.enabled()
            && config.autoExecute()
            && config.isMarketAllowed(signal.instrumentClass().code())
            && config.strategies().contains(signal.strategy());
    }

    /**
     * Confirm a stored signal into a trade.
     *
     * @param quantity null to size from risk per trade
     */
    public Trade confirm(String signalId, BigDecimal quantity) {
        Signal signal = store.findById(signalId).orElseThrow(() -> new SignalNotFoundException(signalId));
        return trades.open(signal, quantity);
    }

    public Optional<Signal> find(String signalId) {
        return store.findById(signalId);
    }

    public List<Signal> list(int limit) {
        return store.list(limit);
    }
}
