package in.smcdesk.service.market;

import in.smcdesk.application.port.input.TradeManagementService;
import in.smcdesk.domain.data.Candle;
import in.smcdesk.domain.data.Timeframe;
import in.smcdesk.domain.trade.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Entry point for pushed market data. A price (tick or candle close) that is
 * the newest known for its symbol refreshes the price cache and is checked
 * against open trades. Older prices, such as a historical backfill, never
 * trigger exits.
 */
public final class MarketDataService {
    private static final Logger log = LoggerFactory.getLogger(MarketDataService.class);

    private final CandleStore candleStore;
    private final MarketDataCache cache;
    private final TradeManagementService trades;

    public MarketDataService(CandleStore candleStore, MarketDataCache cache, TradeManagementService trades) {
        this.candleStore = candleStore;
        this.cache = cache;
        this.trades = trades;
    }

    /**
     * @return trades closed by the tick
     */
    public List<Trade> onTick(String symbol, BigDecimal price, Instant timestamp) {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Price must be positive: " + price);
        }
        if (!cache.updateTick(symbol, price, timestamp)) {
            return List.of();
        }
        List<Trade> closed = trades.onPriceUpdate(symbol, price);
        if (!closed.isEmpty()) {
            log.info("Tick {} @ {} closed {} trade(s)", symbol, price, closed.size());
        }
        return closed;
    }

    /**
     * Store candles; the last close is treated as a tick at its open time.
     *
     * @return number of bars stored for the series
     */
    public int onCandles(String symbol, Timeframe timeframe, List<Candle> candles) {
        int stored = candleStore.append(symbol, timeframe, candles);
        if (!candles.isEmpty()) {
            Candle last = candles.get(candles.size() - 1);
            if (cache.updateTick(symbol, last.close(), last.openTime())) {
                trades.onPriceUpdate(symbol, last.close());
            }
        }
        log.info("Ingested {} candles for {} {} (stored {})", candles.size(), symbol, timeframe.label(), stored);
        return stored;
    }
}
