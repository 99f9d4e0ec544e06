package in.smcdesk.application.service;

import in.smcdesk.application.port.input.TradeManagementService;
import in.smcdesk.application.port.output.TradeRepository;
import in.smcdesk.config.BotConfig;
import in.smcdesk.domain.error.DailyTradeLimitException;
import in.smcdesk.domain.error.NoValidSetupException;
import in.smcdesk.domain.error.TradeAlreadyClosedException;
import in.smcdesk.domain.error.TradeNotFoundException;
import in.smcdesk.domain.portfolio.OpenPositionView;
import in.smcdesk.domain.signal.Direction;
import in.smcdesk.domain.signal.Signal;
import in.smcdesk.domain.signal.TradingMode;
import in.smcdesk.domain.trade.CloseReason;
import in.smcdesk.domain.trade.ManualTradeRequest;
import in.smcdesk.domain.trade.Trade;
import in.smcdesk.infrastructure.metrics.DeskMetrics;
import in.smcdesk.service.market.LivePriceService;
import in.smcdesk.service.risk.PositionSizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * PositionLedger - owner of the trade state machine.
 *
 * OPEN → CLOSED happens exactly once per trade:
 * 1. exit price is resolved first (MANUAL / MARKET / STOP_LOSS / TAKE_PROFIT)
 * 2. status check and transition run on the trade's coordinator partition
 * 3. the repository applies the transition only if the stored row is still OPEN
 *
 * A failed close leaves the trade untouched.
 */
public final class PositionLedger implements TradeManagementService {
    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    private final TradeRepository repository;
    private final LivePriceService priceService;
    private final TradeCoordinator coordinator;
    private final ActiveTradeIndex activeIndex;
    private final PortfolioAggregator portfolio;
    private final Supplier<BotConfig> configSupplier;
    private final DeskMetrics metrics;
    private final Clock clock;

    private final Object openLock = new Object();

    public PositionLedger(TradeRepository repository,
                          LivePriceService priceService,
                          TradeCoordinator coordinator,
                          ActiveTradeIndex activeIndex,
                          PortfolioAggregator portfolio,
                          Supplier<BotConfig> configSupplier,
                          DeskMetrics metrics,
                          Clock clock) {
        this.repository = repository;
        this.priceService = priceService;
        this.coordinator = coordinator;
        this.activeIndex = activeIndex;
        this.portfolio = portfolio;
        this.configSupplier = configSupplier;
        this.metrics = metrics;
        this.clock = clock;

        activeIndex.rebuild(repository.findOpen());
        metrics.updateOpenTrades(activeIndex.size());
    }

    @Override
    public Trade open(Signal signal, BigDecimal quantity) {
        if (signal == null || !signal.direction().isTradable()) {
            throw new IllegalArgumentException("Signal must have a BUY or SELL direction");
        }
        BotConfig config = configSupplier.get();
        BigDecimal live = priceService.getPrice(signal.symbol());

        BigDecimal stopLoss = signal.stopLoss();
        BigDecimal takeProfit = signal.takeProfit1();
        if (config.reanchorOnConfirm()) {
            // keep the signal's distances around the actual fill
            stopLoss = live.add(signal.stopLoss().subtract(signal.optimalEntry()));
            takeProfit = live.add(signal.takeProfit1().subtract(signal.optimalEntry()));
        }

        return openAt(signal.signalId(), signal.symbol(), signal.direction(), live, stopLoss, takeProfit,
            quantity, signal.strategy(), signal.mode(), config);
    }

    @Override
    public Trade open(ManualTradeRequest request) {
        BotConfig config = configSupplier.get();
        BigDecimal live = priceService.getPrice(request.symbol());
        return openAt(null, request.symbol(), request.direction(), live, request.stopLoss(),
            request.takeProfit(), request.quantity(), request.strategy(), request.mode(), config);
    }

    private Trade openAt(String signalId, String symbol, Direction direction, BigDecimal entry,
                         BigDecimal stopLoss, BigDecimal takeProfit, BigDecimal quantity,
                         String strategy, TradingMode mode, BotConfig config) {
        boolean buy = direction == Direction.BUY;
        boolean stopBreached = buy ? entry.compareTo(stopLoss) <= 0 : entry.compareTo(stopLoss) >= 0;
        boolean targetReached = buy ? entry.compareTo(takeProfit) >= 0 : entry.compareTo(takeProfit) <= 0;
        if (stopBreached) {
            throw new NoValidSetupException(symbol, "live price " + entry + " already beyond stop " + stopLoss);
        }
        if (targetReached) {
            throw new NoValidSetupException(symbol, "live price " + entry + " already beyond target " + takeProfit);
        }

        synchronized (openLock) {
            int today = repository.countCreatedSince(startOfDay());
            if (today >= config.maxDailyTrades()) {
                log.warn("Daily trade limit reached: {} trades today, limit={}", today, config.maxDailyTrades());
                throw new DailyTradeLimitException(config.maxDailyTrades());
            }

            BigDecimal qty = quantity != null
                ? quantity
                : PositionSizer.size(config.riskPerTrade(), portfolio.balance(), entry.subtract(stopLoss).abs());

            Trade trade = Trade.open(UUID.randomUUID().toString(), signalId, symbol, direction, entry, qty,
                stopLoss, takeProfit, strategy, mode, clock.instant());
            repository.insert(trade);
            activeIndex.addTrade(trade.tradeId(), symbol);

            metrics.recordTradeOpened(strategy);
            metrics.updateOpenTrades(activeIndex.size());
            log.info("Trade opened: id={} symbol={} dir={} entry={} qty={} sl={} tp={} strategy={}",
                trade.tradeId(), symbol, direction, entry, qty, stopLoss, takeProfit, strategy);
            return trade;
        }
    }

    @Override
    public Trade close(String tradeId, CloseReason reason, BigDecimal manualPrice) {
        Trade trade = repository.findById(tradeId).orElseThrow(() -> new TradeNotFoundException(tradeId));
        if (trade.isClosed()) {
            throw new TradeAlreadyClosedException(tradeId);
        }

        BigDecimal exit = resolveExitPrice(trade, reason, manualPrice);

        return coordinator.executeAndWait(tradeId, () -> {
            Trade current = repository.findById(tradeId).orElseThrow(() -> new TradeNotFoundException(tradeId));
            if (!current.isOpen()) {
                throw new TradeAlreadyClosedException(tradeId);
            }
            Trade closed = current.withClose(exit, reason, clock.instant());
            if (!repository.closeIfOpen(closed)) {
                throw new TradeAlreadyClosedException(tradeId);
            }
            activeIndex.removeTrade(tradeId);

            metrics.recordTradeClosed(reason.name());
            metrics.updateOpenTrades(activeIndex.size());
            log.info("Trade closed: id={} symbol={} reason={} entry={} exit={} pnl={}",
                tradeId, closed.symbol(), reason, closed.entryPrice(), exit, closed.pnl());
            return closed;
        });
    }

    private BigDecimal resolveExitPrice(Trade trade, CloseReason reason, BigDecimal manualPrice) {
        return switch (reason) {
            case MANUAL -> {
                if (manualPrice == null || manualPrice.signum() <= 0) {
                    throw new IllegalArgumentException("MANUAL close requires a positive price");
                }
                yield manualPrice;
            }
            case MARKET -> priceService.getPrice(trade.symbol());
            case STOP_LOSS -> trade.stopLoss();
            case TAKE_PROFIT -> trade.takeProfit();
        };
    }

    @Override
    public List<Trade> onPriceUpdate(String symbol, BigDecimal price) {
        List<Trade> closed = new ArrayList<>();
        for (String tradeId : activeIndex.getOpenTrades(symbol)) {
            Optional<Trade> found = repository.findById(tradeId);
            if (found.isEmpty() || !found.get().isOpen()) {
                activeIndex.removeTrade(tradeId);
                continue;
            }
            Trade trade = found.get();

            CloseReason reason = null;
            if (trade.isStopTouched(price)) {
                reason = CloseReason.STOP_LOSS;
            } else if (trade.isTargetTouched(price)) {
                reason = CloseReason.TAKE_PROFIT;
            }
            if (reason == null) {
                continue;
            }

            try {
                closed.add(close(tradeId, reason, null));
            } catch (TradeAlreadyClosedException e) {
                log.debug("Trade {} closed concurrently, skipping {}", tradeId, reason);
            }
        }
        return closed;
    }

    @Override
    public List<OpenPositionView> getOpenPositions() {
        Map<String, Optional<BigDecimal>> prices = new HashMap<>();
        List<OpenPositionView> views = new ArrayList<>();
        for (Trade trade : repository.findOpen()) {
            Optional<BigDecimal> price = prices.computeIfAbsent(trade.symbol(), priceService::tryGetPrice);
            views.add(new OpenPositionView(
                trade,
                price.orElse(null),
                price.map(trade::floatingPnl).orElse(null)));
        }
        return views;
    }

    @Override
    public List<Trade> getClosedTrades() {
        List<Trade> closed = new ArrayList<>(repository.findClosed());
        closed.sort(Comparator.comparing(Trade::closedAt).reversed());
        return closed;
    }

    public Optional<Trade> findTrade(String tradeId) {
        return repository.findById(tradeId);
    }

    private Instant startOfDay() {
        return LocalDate.now(clock).atStartOfDay(clock.getZone()).toInstant();
    }
}
